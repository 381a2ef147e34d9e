package com.bpmnassistant.core.edit;

import com.bpmnassistant.core.model.ElementType;
import com.bpmnassistant.core.model.ExclusiveBranch;
import com.bpmnassistant.core.model.ProcessElement;
import com.bpmnassistant.core.model.ProcessJsonCodec;
import com.bpmnassistant.core.model.ProcessTree;
import com.bpmnassistant.core.validation.ProcessValidator;
import com.bpmnassistant.core.validation.SchemaViolationException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * The five tree transforms behind the edit verbs.
 *
 * Every transform takes a tree and returns a newly built one, or fails with
 * {@link StructuralEditException}; the input tree is never touched. Element
 * ids are unique tree-wide, so an id names exactly one position.
 */
@Component
public class EditFunctionLibrary {

    private final ProcessValidator processValidator;
    private final ProcessJsonCodec codec;

    public EditFunctionLibrary(ProcessValidator processValidator, ProcessJsonCodec codec) {
        this.processValidator = processValidator;
        this.codec            = codec;
    }

    /**
     * Run the transform named by a validated, non-stop proposal.
     */
    public ProcessTree apply(ProcessTree tree, EditProposal proposal) throws StructuralEditException {
        if (proposal.isStop()) {
            throw new IllegalArgumentException("A stop proposal has no transform");
        }
        return switch (proposal.getFunction()) {
            case DELETE_ELEMENT -> deleteElement(tree, proposal.text("element_id"));
            case REDIRECT_BRANCH -> redirectBranch(tree, proposal.text("branch_condition"), proposal.text("next_id"));
            case ADD_ELEMENT -> addElement(tree, decodeArgument(proposal.node("element")), proposal.anchor());
            case MOVE_ELEMENT -> moveElement(tree, proposal.text("element_id"), proposal.anchor());
            case UPDATE_ELEMENT -> updateElement(tree, decodeArgument(proposal.node("new_element")));
        };
    }

    // =========================================================================
    // Transforms
    // =========================================================================

    /** Remove the element, with its whole subtree, wherever it lives. */
    public ProcessTree deleteElement(ProcessTree tree, String elementId) throws StructuralEditException {
        requireExists(tree, elementId, "Element");
        return rewrite(tree, sequence -> {
            sequence.removeIf(element -> element.getId().equals(elementId));
            return sequence;
        });
    }

    /** Insert a new element right before or after the anchor, at the anchor's depth. */
    public ProcessTree addElement(ProcessTree tree, ProcessElement element, ElementAnchor anchor)
            throws StructuralEditException {
        requireExists(tree, anchor.getTargetId(), "Target element");
        for (String id : ProcessTree.subtreeIds(element)) {
            if (tree.contains(id)) {
                throw new StructuralEditException("Element with id '" + id
                        + "' already exists in the process. Choose a new unique id.");
            }
        }
        return insert(tree, element, anchor);
    }

    /** Detach the subtree rooted at elementId and re-insert it next to the anchor. */
    public ProcessTree moveElement(ProcessTree tree, String elementId, ElementAnchor anchor)
            throws StructuralEditException {
        ProcessElement moved = tree.find(elementId)
                .orElseThrow(() -> new StructuralEditException(
                        "Element with id '" + elementId + "' not found in the process."));
        requireExists(tree, anchor.getTargetId(), "Target element");

        Set<String> movedIds = ProcessTree.subtreeIds(moved);
        if (movedIds.contains(anchor.getTargetId())) {
            throw new StructuralEditException("Cannot move element '" + elementId + "' "
                    + anchor + ": the target lies inside the moved element.");
        }

        ProcessTree detached = deleteElement(tree, elementId);
        return insert(detached, moved, anchor);
    }

    /** Replace the element sharing newElement's id, keeping its position. */
    public ProcessTree updateElement(ProcessTree tree, ProcessElement newElement) throws StructuralEditException {
        String id = newElement.getId();
        requireExists(tree, id, "Element");

        ProcessTree updated = rewrite(tree, sequence -> {
            sequence.replaceAll(element -> element.getId().equals(id) ? newElement : element);
            return sequence;
        });

        List<String> duplicates = updated.duplicateIds();
        if (!duplicates.isEmpty()) {
            throw new StructuralEditException("Updating element '" + id
                    + "' would duplicate existing ids " + duplicates + ".");
        }
        return updated;
    }

    /**
     * Point the first exclusive branch (document order) whose condition is
     * branchCondition at nextId. nextId stays where it is.
     */
    public ProcessTree redirectBranch(ProcessTree tree, String branchCondition, String nextId)
            throws StructuralEditException {
        requireExists(tree, nextId, "Target element");

        String gatewayId = findGatewayWithCondition(tree.getElements(), branchCondition);
        if (gatewayId == null) {
            throw new StructuralEditException(
                    "Branch with condition '" + branchCondition + "' not found in the process.");
        }

        return rewrite(tree, sequence -> {
            sequence.replaceAll(element -> element.getId().equals(gatewayId)
                    ? redirectFirstMatch(element, branchCondition, nextId)
                    : element);
            return sequence;
        });
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /** Pre-order search for the exclusive gateway owning the first branch with the condition. */
    private static String findGatewayWithCondition(List<ProcessElement> sequence, String condition) {
        for (ProcessElement element : sequence) {
            if (element.getType() == ElementType.EXCLUSIVE_GATEWAY) {
                for (ExclusiveBranch branch : element.getExclusiveBranches()) {
                    if (branch.getCondition().equals(condition)) {
                        return element.getId();
                    }
                }
            }
            for (List<ProcessElement> child : element.childSequences()) {
                String found = findGatewayWithCondition(child, condition);
                if (found != null) return found;
            }
        }
        return null;
    }

    private static ProcessElement redirectFirstMatch(ProcessElement gateway, String condition, String nextId) {
        List<ExclusiveBranch> branches = new ArrayList<>(gateway.getExclusiveBranches());
        for (int i = 0; i < branches.size(); i++) {
            if (branches.get(i).getCondition().equals(condition)) {
                branches.set(i, branches.get(i).withNext(nextId));
                break;
            }
        }
        return gateway.withExclusiveBranches(branches);
    }

    private ProcessElement decodeArgument(JsonNode element) throws StructuralEditException {
        try {
            processValidator.validateElement(element);
        } catch (SchemaViolationException e) {
            throw new StructuralEditException("Invalid element: " + e.getMessage());
        }
        return codec.decodeElement(element);
    }

    private static void requireExists(ProcessTree tree, String id, String what) throws StructuralEditException {
        if (!tree.contains(id)) {
            throw new StructuralEditException(what + " with id '" + id + "' not found in the process.");
        }
    }

    private static ProcessTree insert(ProcessTree tree, ProcessElement element, ElementAnchor anchor) {
        return rewrite(tree, sequence -> {
            for (int i = 0; i < sequence.size(); i++) {
                if (sequence.get(i).getId().equals(anchor.getTargetId())) {
                    int at = anchor.getPosition() == ElementAnchor.Position.BEFORE ? i : i + 1;
                    sequence.add(at, element);
                    return sequence;
                }
            }
            return sequence;
        });
    }

    /**
     * Rebuild every sequence of the tree, innermost first, passing each one
     * (as a mutable copy) through op. Gateways whose children were rebuilt
     * are recreated around the new children.
     */
    static ProcessTree rewrite(ProcessTree tree, UnaryOperator<List<ProcessElement>> op) {
        return new ProcessTree(rewriteSequence(tree.getElements(), op));
    }

    private static List<ProcessElement> rewriteSequence(List<ProcessElement> sequence,
                                                        UnaryOperator<List<ProcessElement>> op) {
        List<ProcessElement> rebuilt = new ArrayList<>(sequence.size());
        for (ProcessElement element : sequence) {
            rebuilt.add(rewriteChildren(element, op));
        }
        return op.apply(rebuilt);
    }

    private static ProcessElement rewriteChildren(ProcessElement element, UnaryOperator<List<ProcessElement>> op) {
        switch (element.getType()) {
            case EXCLUSIVE_GATEWAY: {
                List<ExclusiveBranch> branches = new ArrayList<>();
                for (ExclusiveBranch branch : element.getExclusiveBranches()) {
                    branches.add(branch.withPath(rewriteSequence(branch.getPath(), op)));
                }
                return element.withExclusiveBranches(branches);
            }
            case PARALLEL_GATEWAY: {
                List<List<ProcessElement>> branches = new ArrayList<>();
                for (List<ProcessElement> branch : element.getParallelBranches()) {
                    branches.add(rewriteSequence(branch, op));
                }
                return element.withParallelBranches(branches);
            }
            default:
                return element;
        }
    }
}
