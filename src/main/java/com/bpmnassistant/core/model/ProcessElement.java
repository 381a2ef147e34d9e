package com.bpmnassistant.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ProcessElement: immutable node of a process tree.
 *
 * A tagged union keyed by {@link ElementType}; the variant decides which
 * fields are populated:
 *
 *   task / userTask / serviceTask   label
 *   exclusiveGateway                label, exclusiveBranches
 *   parallelGateway                 parallelBranches
 *
 * Fields a variant does not use are null (label) or empty (branches).
 * Construction goes through the static factories only.
 */
public final class ProcessElement {

    private final String                     id;
    private final ElementType                type;
    private final String                     label;
    private final List<ExclusiveBranch>      exclusiveBranches;
    private final List<List<ProcessElement>> parallelBranches;

    private ProcessElement(
            String                     id,
            ElementType                type,
            String                     label,
            List<ExclusiveBranch>      exclusiveBranches,
            List<List<ProcessElement>> parallelBranches
    ) {
        this.id                = Objects.requireNonNull(id, "id");
        this.type              = Objects.requireNonNull(type, "type");
        this.label             = label;
        this.exclusiveBranches = exclusiveBranches != null ? List.copyOf(exclusiveBranches) : List.of();
        this.parallelBranches  = copyBranches(parallelBranches);
    }

    // =========================================================================
    // Static factories
    // =========================================================================

    public static ProcessElement task(String id, ElementType type, String label) {
        if (!type.isTaskLike()) {
            throw new IllegalArgumentException(type.getWireName() + " is not a task type");
        }
        return new ProcessElement(id, type, Objects.requireNonNull(label, "label"), null, null);
    }

    public static ProcessElement task(String id, String label) {
        return task(id, ElementType.TASK, label);
    }

    public static ProcessElement exclusiveGateway(String id, String label, List<ExclusiveBranch> branches) {
        return new ProcessElement(id, ElementType.EXCLUSIVE_GATEWAY,
                Objects.requireNonNull(label, "label"), branches, null);
    }

    public static ProcessElement parallelGateway(String id, List<List<ProcessElement>> branches) {
        return new ProcessElement(id, ElementType.PARALLEL_GATEWAY, null, null, branches);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String getId() {
        return id;
    }

    public ElementType getType() {
        return type;
    }

    /** Null for parallel gateways. */
    public String getLabel() {
        return label;
    }

    public List<ExclusiveBranch> getExclusiveBranches() {
        return exclusiveBranches;
    }

    public List<List<ProcessElement>> getParallelBranches() {
        return parallelBranches;
    }

    /**
     * Every nested sequence in document order: exclusive paths or
     * parallel branch bodies. Empty for task-like elements.
     */
    public List<List<ProcessElement>> childSequences() {
        switch (type) {
            case EXCLUSIVE_GATEWAY: {
                List<List<ProcessElement>> sequences = new ArrayList<>();
                for (ExclusiveBranch branch : exclusiveBranches) {
                    sequences.add(branch.getPath());
                }
                return sequences;
            }
            case PARALLEL_GATEWAY:
                return parallelBranches;
            default:
                return List.of();
        }
    }

    /** Same element with its exclusive branches replaced. */
    public ProcessElement withExclusiveBranches(List<ExclusiveBranch> branches) {
        if (type != ElementType.EXCLUSIVE_GATEWAY) {
            throw new IllegalStateException(id + " is not an exclusive gateway");
        }
        return new ProcessElement(id, type, label, branches, null);
    }

    /** Same element with its parallel branch bodies replaced. */
    public ProcessElement withParallelBranches(List<List<ProcessElement>> branches) {
        if (type != ElementType.PARALLEL_GATEWAY) {
            throw new IllegalStateException(id + " is not a parallel gateway");
        }
        return new ProcessElement(id, type, null, null, branches);
    }

    private static List<List<ProcessElement>> copyBranches(List<List<ProcessElement>> branches) {
        if (branches == null) return List.of();
        List<List<ProcessElement>> copy = new ArrayList<>(branches.size());
        for (List<ProcessElement> branch : branches) {
            copy.add(List.copyOf(branch));
        }
        return List.copyOf(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProcessElement)) return false;
        ProcessElement other = (ProcessElement) o;
        return id.equals(other.id)
                && type == other.type
                && Objects.equals(label, other.label)
                && exclusiveBranches.equals(other.exclusiveBranches)
                && parallelBranches.equals(other.parallelBranches);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, label, exclusiveBranches, parallelBranches);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(type.getWireName()).append('(').append(id);
        if (label != null) sb.append(", '").append(label).append('\'');
        sb.append(')');
        if (!exclusiveBranches.isEmpty()) sb.append(' ').append(exclusiveBranches);
        if (!parallelBranches.isEmpty()) sb.append(' ').append(parallelBranches);
        return sb.toString();
    }
}
