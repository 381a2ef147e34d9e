package com.bpmnassistant.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ProcessTree: immutable value of a whole process.
 *
 * Edits never change a tree; they build a new one. The last accepted tree
 * therefore stays valid as a fallback while a retry is in flight.
 */
public final class ProcessTree {

    private final List<ProcessElement> elements;

    public ProcessTree(List<ProcessElement> elements) {
        this.elements = elements != null ? List.copyOf(elements) : List.of();
    }

    public static ProcessTree of(ProcessElement... elements) {
        return new ProcessTree(List.of(elements));
    }

    /** Top-level sequence. */
    public List<ProcessElement> getElements() {
        return elements;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public boolean contains(String id) {
        return find(id).isPresent();
    }

    /** Depth-first search for the element with the given id, at any depth. */
    public Optional<ProcessElement> find(String id) {
        return findIn(elements, id);
    }

    /** Ids of every element, depth-first in document order. */
    public Set<String> allIds() {
        Set<String> ids = new LinkedHashSet<>();
        collectIds(elements, ids, new ArrayList<>());
        return ids;
    }

    /** Ids that occur more than once anywhere in the tree. */
    public List<String> duplicateIds() {
        List<String> duplicates = new ArrayList<>();
        collectIds(elements, new LinkedHashSet<>(), duplicates);
        return duplicates;
    }

    /** Ids of the element and everything nested under it. */
    public static Set<String> subtreeIds(ProcessElement root) {
        Set<String> ids = new LinkedHashSet<>();
        collectIds(List.of(root), ids, new ArrayList<>());
        return ids;
    }

    static Optional<ProcessElement> findIn(List<ProcessElement> sequence, String id) {
        for (ProcessElement element : sequence) {
            if (element.getId().equals(id)) {
                return Optional.of(element);
            }
            for (List<ProcessElement> child : element.childSequences()) {
                Optional<ProcessElement> found = findIn(child, id);
                if (found.isPresent()) return found;
            }
        }
        return Optional.empty();
    }

    private static void collectIds(List<ProcessElement> sequence, Set<String> seen, List<String> duplicates) {
        for (ProcessElement element : sequence) {
            if (!seen.add(element.getId())) {
                duplicates.add(element.getId());
            }
            for (List<ProcessElement> child : element.childSequences()) {
                collectIds(child, seen, duplicates);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProcessTree)) return false;
        return elements.equals(((ProcessTree) o).elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elements);
    }

    @Override
    public String toString() {
        return "ProcessTree" + elements;
    }
}
