package com.example.workflowsynth.repair;

import com.example.workflowsynth.domain.NodeTypes;
import com.example.workflowsynth.domain.Ports;
import com.example.workflowsynth.domain.WorkflowNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One heuristic for reconnecting an orphan node. Rules are tried in a fixed order (see {@link ReattachmentRules});
 * the first rule returning a non-empty list wins.
 * <p>
 * Rules never propose an edge into a trigger-type node and never propose a self-edge.
 * </p>
 */
public sealed interface ReattachmentRule
        permits ReattachmentRule.ErrorHandler, ReattachmentRule.FinalStep, ReattachmentRule.NearestLeftNode,
        ReattachmentRule.BranchCompletion, ReattachmentRule.FragmentErrorPort {

    String name();

    /**
     * @return the edges that attach {@code orphan}; empty when the rule does not apply
     */
    List<Attachment> apply(WorkflowNode orphan, RepairScope scope);

    /**
     * Error-sounding nodes hang off the error port of the second-to-last node of the fragment.
     */
    final class ErrorHandler implements ReattachmentRule {

        @Override
        public String name() {
            return "error-handler";
        }

        @Override
        public List<Attachment> apply(WorkflowNode orphan, RepairScope scope) {
            if (!NodeNames.containsAny(orphan.name(), NodeNames.ERROR_KEYWORDS)) {
                return List.of();
            }
            List<WorkflowNode> nodes = scope.nodes();
            if (nodes.size() < 2) {
                return List.of();
            }
            WorkflowNode source = nodes.get(nodes.size() - 2);
            if (source.name().equals(orphan.name())) {
                return List.of();
            }
            return List.of(new Attachment(source.name(), Ports.ERROR, orphan.name()));
        }
    }

    /**
     * Final-step nodes follow whichever node most recently gained an outgoing edge.
     */
    final class FinalStep implements ReattachmentRule {

        @Override
        public String name() {
            return "final-step";
        }

        @Override
        public List<Attachment> apply(WorkflowNode orphan, RepairScope scope) {
            if (!NodeNames.containsAny(orphan.name(), NodeNames.FINAL_STEP_KEYWORDS)) {
                return List.of();
            }
            return scope.mostRecentSource(orphan.name())
                    .map(source -> List.of(new Attachment(source, Ports.SUCCESS, orphan.name())))
                    .orElse(List.of());
        }
    }

    /**
     * Fallback: the attached node to the left (lower x) with the smallest Euclidean distance.
     * Equal distances resolve to the earlier node in array order. Error-sounding orphans with a known
     * fragment only consider nodes of that fragment.
     */
    final class NearestLeftNode implements ReattachmentRule {

        @Override
        public String name() {
            return "nearest-left-node";
        }

        @Override
        public List<Attachment> apply(WorkflowNode orphan, RepairScope scope) {
            Optional<String> ownFragment = NodeNames.containsAny(orphan.name(), NodeNames.FRAGMENT_ERROR_KEYWORDS)
                    ? scope.fragmentOf(orphan.name())
                    : Optional.empty();
            WorkflowNode nearest = null;
            double best = Double.POSITIVE_INFINITY;
            for (WorkflowNode candidate : scope.nodes()) {
                if (candidate.name().equals(orphan.name()) || !scope.isAttached(candidate.name())) {
                    continue;
                }
                if (ownFragment.isPresent() && !ownFragment.equals(scope.fragmentOf(candidate.name()))) {
                    continue;
                }
                if (candidate.position().x() >= orphan.position().x()) {
                    continue;
                }
                double distance = candidate.position().distanceTo(orphan.position());
                if (distance < best) {
                    best = distance;
                    nearest = candidate;
                }
            }
            if (nearest == null) {
                return List.of();
            }
            return List.of(new Attachment(nearest.name(), Ports.SUCCESS, orphan.name()));
        }
    }

    /**
     * Merge- or final-sounding nodes (and merge-type nodes) collect every attached branch-completion node
     * across all fragments.
     */
    final class BranchCompletion implements ReattachmentRule {

        @Override
        public String name() {
            return "branch-completion";
        }

        @Override
        public List<Attachment> apply(WorkflowNode orphan, RepairScope scope) {
            boolean applies = NodeNames.containsAny(orphan.name(), NodeNames.MERGE_KEYWORDS)
                    || NodeTypes.isMerge(orphan.type());
            if (!applies) {
                return List.of();
            }
            List<Attachment> attachments = new ArrayList<>();
            for (WorkflowNode candidate : scope.nodes()) {
                if (candidate.name().equals(orphan.name()) || !scope.isAttached(candidate.name())) {
                    continue;
                }
                if (!NodeNames.containsAny(candidate.name(), NodeNames.BRANCH_END_KEYWORDS)
                        || NodeNames.containsAny(candidate.name(), NodeNames.ERROR_KEYWORDS)) {
                    continue;
                }
                if (scope.connections().hasEdge(candidate.name(), orphan.name())) {
                    continue;
                }
                attachments.add(new Attachment(candidate.name(), Ports.SUCCESS, orphan.name()));
            }
            return attachments;
        }
    }

    /**
     * Error-sounding nodes attach to the error port of the last attached node of their own fragment.
     */
    final class FragmentErrorPort implements ReattachmentRule {

        @Override
        public String name() {
            return "fragment-error-port";
        }

        @Override
        public List<Attachment> apply(WorkflowNode orphan, RepairScope scope) {
            if (!NodeNames.containsAny(orphan.name(), NodeNames.FRAGMENT_ERROR_KEYWORDS)) {
                return List.of();
            }
            Optional<String> fragment = scope.fragmentOf(orphan.name());
            if (fragment.isEmpty()) {
                return List.of();
            }
            WorkflowNode last = null;
            for (WorkflowNode candidate : scope.nodes()) {
                if (candidate.name().equals(orphan.name()) || !scope.isAttached(candidate.name())) {
                    continue;
                }
                if (fragment.equals(scope.fragmentOf(candidate.name()))) {
                    last = candidate;
                }
            }
            if (last == null) {
                return List.of();
            }
            return List.of(new Attachment(last.name(), Ports.ERROR, orphan.name()));
        }
    }
}
