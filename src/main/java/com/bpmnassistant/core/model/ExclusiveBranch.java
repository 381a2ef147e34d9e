package com.bpmnassistant.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One outgoing branch of an exclusive gateway.
 *
 * {@code next} is the id the branch continues to after its path, or null
 * when the branch simply rejoins after the gateway.
 */
public final class ExclusiveBranch {

    private final String               condition;
    private final List<ProcessElement> path;
    private final String               next;

    public ExclusiveBranch(String condition, List<ProcessElement> path, String next) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.path      = path != null ? List.copyOf(path) : List.of();
        this.next      = next;
    }

    public ExclusiveBranch(String condition, List<ProcessElement> path) {
        this(condition, path, null);
    }

    public String getCondition() {
        return condition;
    }

    public List<ProcessElement> getPath() {
        return path;
    }

    /** Continuation target, or null. */
    public String getNext() {
        return next;
    }

    public ExclusiveBranch withPath(List<ProcessElement> newPath) {
        return new ExclusiveBranch(condition, newPath, next);
    }

    public ExclusiveBranch withNext(String newNext) {
        return new ExclusiveBranch(condition, path, newNext);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExclusiveBranch)) return false;
        ExclusiveBranch other = (ExclusiveBranch) o;
        return condition.equals(other.condition)
                && path.equals(other.path)
                && Objects.equals(next, other.next);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, path, next);
    }

    @Override
    public String toString() {
        return "Branch[" + condition + (next != null ? " -> " + next : "") + "] " + path;
    }
}
