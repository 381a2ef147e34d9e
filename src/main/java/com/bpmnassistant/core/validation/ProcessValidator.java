package com.bpmnassistant.core.validation;

import com.bpmnassistant.core.model.ElementType;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive type check of a process tree in its JSON form.
 *
 * Rules, checked element by element in document order:
 *   1. element is an object with string {@code id} and {@code type}
 *   2. {@code type} is one of {@link ElementType#wireNames()}
 *   3. task-like types carry a non-empty {@code label}
 *   4. exclusiveGateway carries a non-empty {@code label} and a {@code branches}
 *      array whose entries have a string {@code condition} and an array
 *      {@code path}; an optional {@code next} must be a string
 *   5. parallelGateway carries a {@code branches} array of arrays
 *   6. ids are unique across the whole tree
 *   7. every branch {@code next} names an element of the same tree
 *      (whole-process validation only)
 *
 * The first violation aborts; there is no partial validity.
 */
@Component
public class ProcessValidator {

    /** Validate a whole process (a JSON array of elements). */
    public void validate(JsonNode process) throws SchemaViolationException {
        if (process == null || !process.isArray()) {
            throw new SchemaViolationException(
                    "Process must be a JSON array of elements, got: " + describe(process));
        }
        Set<String>         seenIds     = new HashSet<>();
        Map<String, String> nextTargets = new LinkedHashMap<>();
        validateSequence(process, seenIds, nextTargets);

        for (Map.Entry<String, String> target : nextTargets.entrySet()) {
            if (!seenIds.contains(target.getKey())) {
                throw new SchemaViolationException("Branch 'next' in exclusive gateway '" + target.getValue()
                        + "' points at element ID '" + target.getKey() + "', which is not in the process.");
            }
        }
    }

    /**
     * Validate one element and everything nested under it, without looking
     * at the rest of the tree.
     */
    public void validateElement(JsonNode element) throws SchemaViolationException {
        validateElement(element, new HashSet<>(), new LinkedHashMap<>());
    }

    private void validateSequence(JsonNode sequence, Set<String> seenIds, Map<String, String> nextTargets)
            throws SchemaViolationException {
        for (JsonNode element : sequence) {
            validateElement(element, seenIds, nextTargets);
        }
    }

    /** nextTargets collects branch next id → owning gateway id. */
    private void validateElement(JsonNode element, Set<String> seenIds, Map<String, String> nextTargets)
            throws SchemaViolationException {
        if (element == null || !element.isObject()) {
            throw new SchemaViolationException("Element must be a JSON object: " + describe(element));
        }
        if (!element.hasNonNull("id")) {
            throw new SchemaViolationException("Element is missing an ID: " + element);
        }
        if (!element.get("id").isTextual() || element.get("id").asText().isBlank()) {
            throw new SchemaViolationException("Element ID must be a non-empty string: " + element);
        }
        if (!element.hasNonNull("type")) {
            throw new SchemaViolationException("Element is missing a type: " + element);
        }

        String id = element.get("id").asText();
        String typeName = element.get("type").asText();
        Optional<ElementType> type = element.get("type").isTextual()
                ? ElementType.fromWireName(typeName)
                : Optional.empty();

        if (type.isEmpty()) {
            throw new SchemaViolationException("Unsupported element type: " + element.get("type")
                    + ". Supported types: " + ElementType.wireNames());
        }

        if (!seenIds.add(id)) {
            throw new SchemaViolationException("Duplicate element ID '" + id + "': " + element);
        }

        switch (type.get()) {
            case TASK, USER_TASK, SERVICE_TASK -> requireLabel(element, "Task element");
            case EXCLUSIVE_GATEWAY -> validateExclusiveGateway(element, seenIds, nextTargets);
            case PARALLEL_GATEWAY -> validateParallelGateway(element, seenIds, nextTargets);
        }
    }

    private void validateExclusiveGateway(JsonNode element, Set<String> seenIds, Map<String, String> nextTargets)
            throws SchemaViolationException {
        requireLabel(element, "Exclusive gateway");

        JsonNode branches = element.get("branches");
        if (branches == null || !branches.isArray()) {
            throw new SchemaViolationException(
                    "Exclusive gateway is missing or has invalid 'branches': " + element);
        }

        for (JsonNode branch : branches) {
            if (!branch.isObject()
                    || !branch.hasNonNull("condition") || !branch.get("condition").isTextual()
                    || !branch.has("path") || !branch.get("path").isArray()) {
                throw new SchemaViolationException(
                        "Invalid branch in exclusive gateway '" + element.get("id").asText()
                        + "' (needs a string 'condition' and an array 'path'): " + branch);
            }
            if (branch.get("condition").asText().isBlank()) {
                throw new SchemaViolationException("Branch condition must be a non-empty string in exclusive gateway '"
                        + element.get("id").asText() + "': " + branch);
            }
            if (branch.hasNonNull("next")) {
                if (!branch.get("next").isTextual()) {
                    throw new SchemaViolationException(
                            "Branch 'next' must be an element ID string in exclusive gateway '"
                            + element.get("id").asText() + "': " + branch);
                }
                nextTargets.putIfAbsent(branch.get("next").asText(), element.get("id").asText());
            }
            validateSequence(branch.get("path"), seenIds, nextTargets);
        }
    }

    private void validateParallelGateway(JsonNode element, Set<String> seenIds, Map<String, String> nextTargets)
            throws SchemaViolationException {
        JsonNode branches = element.get("branches");
        if (branches == null || !branches.isArray()) {
            throw new SchemaViolationException(
                    "Parallel gateway is missing or has invalid 'branches': " + element);
        }

        for (JsonNode branch : branches) {
            if (!branch.isArray()) {
                throw new SchemaViolationException(
                        "Invalid branch in parallel gateway '" + element.get("id").asText()
                        + "' (each branch must be an array of elements): " + branch);
            }
            validateSequence(branch, seenIds, nextTargets);
        }
    }

    private void requireLabel(JsonNode element, String kind) throws SchemaViolationException {
        JsonNode label = element.get("label");
        if (label == null || label.isNull()) {
            throw new SchemaViolationException(kind + " is missing a label: " + element);
        }
        if (!label.isTextual() || label.asText().isBlank()) {
            throw new SchemaViolationException(kind + " label must be a non-empty string: " + element);
        }
    }

    private static String describe(JsonNode node) {
        return node == null || node.isMissingNode() ? "nothing" : node.toString();
    }
}
