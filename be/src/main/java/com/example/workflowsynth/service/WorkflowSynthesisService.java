package com.example.workflowsynth.service;

import com.example.workflowsynth.assembly.AssembledGraph;
import com.example.workflowsynth.assembly.GraphAssembler;
import com.example.workflowsynth.assembly.MergePoint;
import com.example.workflowsynth.assembly.TriggerType;
import com.example.workflowsynth.codec.WorkflowJsonCodec;
import com.example.workflowsynth.config.SynthesisProperties;
import com.example.workflowsynth.fragment.FragmentDraft;
import com.example.workflowsynth.fragment.FragmentParser;
import com.example.workflowsynth.fragment.FragmentRepairer;
import com.example.workflowsynth.fragment.RepairedFragment;
import com.example.workflowsynth.repair.GlobalConnectivityRepairer;
import com.example.workflowsynth.repair.GlobalRepairResult;
import com.example.workflowsynth.repair.RepairAction;
import com.example.workflowsynth.synthesis.AssemblyRequest;
import com.example.workflowsynth.synthesis.BranchPlan;
import com.example.workflowsynth.synthesis.FragmentGenerator;
import com.example.workflowsynth.synthesis.FragmentInput;
import com.example.workflowsynth.synthesis.SynthesisResult;
import com.example.workflowsynth.synthesis.WorkflowPlan;
import com.example.workflowsynth.synthesis.WorkflowPlanner;
import com.example.workflowsynth.validation.IssueKind;
import com.example.workflowsynth.validation.StructuralValidator;
import com.example.workflowsynth.validation.ValidationIssue;
import com.example.workflowsynth.validation.ValidationReport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the synthesis pipeline: plan, generate fragments concurrently, then parse, repair, assemble,
 * repair globally and validate.
 * <p>
 * Only fragment generation is concurrent. Everything after the join runs on the calling thread over fresh
 * per-call state.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowSynthesisService {

    private final WorkflowPlanner planner;
    private final FragmentGenerator fragmentGenerator;
    private final FragmentParser fragmentParser;
    private final FragmentRepairer fragmentRepairer;
    private final GraphAssembler graphAssembler;
    private final GlobalConnectivityRepairer globalRepairer;
    private final StructuralValidator validator;
    private final ExecutorService fragmentGenerationExecutor;
    private final SynthesisProperties properties;

    /**
     * Generates a workflow from a natural-language request. A failed or timed-out fragment becomes an empty
     * fragment plus a warning; the rest of the workflow is still assembled.
     */
    public SynthesisResult synthesize(String name, String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt is required");
        }
        WorkflowPlan plan = planner.plan(prompt);
        log.info("Synthesizing workflow name={} branches={} trigger={}",
                name, plan.branches().size(), plan.mainTrigger().type().getValue());

        List<CompletableFuture<String>> futures = new ArrayList<>();
        for (BranchPlan branch : plan.branches()) {
            futures.add(CompletableFuture.supplyAsync(() -> fragmentGenerator.generate(branch, prompt),
                    fragmentGenerationExecutor));
        }

        Duration timeout = properties.getGeneration().getTimeout();
        List<FragmentDraft> drafts = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            drafts.add(awaitFragment(plan.branches().get(i).name(), futures.get(i), timeout));
        }
        return assembleDrafts(name, plan.mainTrigger().type(), drafts, plan.mergePoints());
    }

    /**
     * Assembles caller-supplied fragment definitions without calling the model.
     */
    public SynthesisResult assemble(AssemblyRequest request) {
        List<FragmentDraft> drafts = new ArrayList<>();
        for (FragmentInput fragment : request.fragments()) {
            drafts.add(fragmentParser.parse(fragment.name(), fragment.definition()));
        }
        return assembleDrafts(request.name(), request.triggerType(), drafts, request.mergePoints());
    }

    /**
     * Validates an output-boundary workflow JSON as-is; no repair is applied.
     */
    public ValidationReport validate(Map<String, Object> workflowJson) {
        if (workflowJson == null) {
            throw new IllegalArgumentException("workflow is required");
        }
        return validator.validate(WorkflowJsonCodec.fromJson(workflowJson));
    }

    private FragmentDraft awaitFragment(String branchName, CompletableFuture<String> future, Duration timeout) {
        try {
            String text = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return fragmentParser.parseText(branchName, text);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Fragment generation timed out branch={} timeout={}", branchName, timeout);
            return failed(branchName, "timed out after " + timeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Fragment generation failed branch={} error={}", branchName, cause.getMessage());
            return failed(branchName, cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while waiting for fragment branch={}", branchName);
            return failed(branchName, "interrupted");
        }
    }

    private static FragmentDraft failed(String branchName, String reason) {
        return FragmentDraft.empty(branchName, ValidationIssue.warning(null, branchName, IssueKind.GENERATION_FAILED,
                "Generation of fragment \"" + branchName + "\" failed: " + reason,
                "Retry the request or simplify the branch"));
    }

    /**
     * Later fragments reusing an earlier fragment's name become {@code "<name> 2"}, {@code "<name> 3"}...
     * Merge points naming the shared name keep referring to the first fragment.
     */
    static List<FragmentDraft> uniqueFragmentNames(List<FragmentDraft> drafts) {
        Set<String> reserved = new HashSet<>();
        drafts.forEach(d -> reserved.add(d.name()));
        Set<String> seen = new HashSet<>();
        List<FragmentDraft> unique = new ArrayList<>(drafts.size());
        for (FragmentDraft draft : drafts) {
            if (seen.add(draft.name())) {
                unique.add(draft);
                continue;
            }
            String renamed = draft.name();
            for (int n = 2; reserved.contains(renamed); n++) {
                renamed = draft.name() + " " + n;
            }
            reserved.add(renamed);
            seen.add(renamed);
            log.debug("Renamed duplicate fragment from={} to={}", draft.name(), renamed);
            unique.add(draft.renamed(renamed, "duplicate fragment name \"" + draft.name() + "\""));
        }
        return unique;
    }

    private SynthesisResult assembleDrafts(String name, TriggerType triggerType, List<FragmentDraft> drafts,
                                           List<MergePoint> mergePoints) {
        List<RepairedFragment> repaired = new ArrayList<>(drafts.size());
        for (FragmentDraft draft : uniqueFragmentNames(drafts)) {
            repaired.add(fragmentRepairer.repair(draft));
        }
        AssembledGraph assembled = graphAssembler.assemble(name, triggerType, repaired, mergePoints);
        GlobalRepairResult global = globalRepairer.repair(assembled);
        ValidationReport report = validator.validate(global.graph());

        List<RepairAction> actions = new ArrayList<>(assembled.actions());
        actions.addAll(global.actions());
        List<ValidationIssue> warnings = new ArrayList<>(assembled.warnings());
        warnings.addAll(global.warnings());

        log.info("Synthesis complete name={} nodes={} valid={} repairActions={} unresolved={}",
                global.graph().name(), global.graph().nodes().size(), report.isValid(), actions.size(),
                global.unresolvedOrphans().size());
        return new SynthesisResult(WorkflowJsonCodec.toJson(global.graph()), assembled.entryNodes(),
                global.unresolvedOrphans(), report, actions, warnings);
    }
}
