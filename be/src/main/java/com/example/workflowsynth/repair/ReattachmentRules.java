package com.example.workflowsynth.repair;

import com.example.workflowsynth.domain.NodeTypes;
import com.example.workflowsynth.domain.WorkflowNode;

import java.util.List;
import java.util.Optional;

/**
 * Ordered rule lists for the fragment-level and the graph-level reattachment passes.
 */
public final class ReattachmentRules {

    /** Within one fragment: error handler, final step, nearest node to the left. */
    public static final List<ReattachmentRule> FRAGMENT = List.of(
            new ReattachmentRule.ErrorHandler(),
            new ReattachmentRule.FinalStep(),
            new ReattachmentRule.NearestLeftNode()
    );

    /** Over the assembled graph: branch completion, error port in own fragment, nearest node to the left. */
    public static final List<ReattachmentRule> GLOBAL = List.of(
            new ReattachmentRule.BranchCompletion(),
            new ReattachmentRule.FragmentErrorPort(),
            new ReattachmentRule.NearestLeftNode()
    );

    private ReattachmentRules() {
    }

    /** The winning rule and its attachments. */
    public record Match(ReattachmentRule rule, List<Attachment> attachments) {
    }

    public static Optional<Match> firstMatch(List<ReattachmentRule> rules, WorkflowNode orphan, RepairScope scope) {
        if (NodeTypes.isTrigger(orphan)) {
            return Optional.empty();
        }
        for (ReattachmentRule rule : rules) {
            List<Attachment> attachments = rule.apply(orphan, scope);
            if (!attachments.isEmpty()) {
                return Optional.of(new Match(rule, attachments));
            }
        }
        return Optional.empty();
    }
}
