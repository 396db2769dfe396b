package com.example.workflowsynth.synthesis;

import com.example.workflowsynth.repair.RepairAction;
import com.example.workflowsynth.validation.ValidationIssue;
import com.example.workflowsynth.validation.ValidationReport;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Best-effort assembled workflow with everything the engine decided or noticed on the way.
 *
 * @param workflow          the output-boundary JSON ({@code name, nodes, connections, settings})
 * @param entryNodes        fragment entry nodes, in fragment order
 * @param unresolvedOrphans nodes no reattachment rule could connect; also reported as {@code disconnected_node}
 * @param warnings          recovered pipeline problems (malformed or empty fragments, unknown merge sources)
 */
public record SynthesisResult(
        Map<String, Object> workflow,
        List<String> entryNodes,
        List<String> unresolvedOrphans,
        ValidationReport report,
        List<RepairAction> repairActions,
        List<ValidationIssue> warnings
) {
    public SynthesisResult {
        Objects.requireNonNull(workflow, "workflow");
        Objects.requireNonNull(report, "report");
        entryNodes = entryNodes != null ? List.copyOf(entryNodes) : List.of();
        unresolvedOrphans = unresolvedOrphans != null ? List.copyOf(unresolvedOrphans) : List.of();
        repairActions = repairActions != null ? List.copyOf(repairActions) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
