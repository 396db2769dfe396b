package com.example.workflowsynth.api.v1;

import com.example.workflowsynth.api.v1.dto.NodeTypeDto;
import com.example.workflowsynth.validation.NodeTypeCatalog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Lists the node types the validator knows, sorted by type.
 */
@RestController
@RequestMapping("/api/v1/node-types")
@RequiredArgsConstructor
@Slf4j
public class NodeTypesController {

    private final NodeTypeCatalog catalog;

    @GetMapping
    public List<NodeTypeDto> list() {
        List<NodeTypeDto> types = catalog.all().stream()
                .map(d -> new NodeTypeDto(d.type(), d.category(), d.description()))
                .toList();
        log.debug("Listing node types count={}", types.size());
        return types;
    }
}
