package com.bpmnassistant.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Discriminant of a {@link ProcessElement}.
 *
 * Task-like types carry a label only. EXCLUSIVE_GATEWAY carries a label and
 * conditional branches; PARALLEL_GATEWAY carries unconditional branches.
 */
public enum ElementType {
    TASK("task"),
    USER_TASK("userTask"),
    SERVICE_TASK("serviceTask"),
    EXCLUSIVE_GATEWAY("exclusiveGateway"),
    PARALLEL_GATEWAY("parallelGateway");

    private final String wireName;

    ElementType(String wireName) {
        this.wireName = wireName;
    }

    /** The value of the JSON {@code type} field. */
    public String getWireName() {
        return wireName;
    }

    public boolean isTaskLike() {
        return this == TASK || this == USER_TASK || this == SERVICE_TASK;
    }

    public boolean isGateway() {
        return !isTaskLike();
    }

    public static Optional<ElementType> fromWireName(String wireName) {
        for (ElementType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static List<String> wireNames() {
        List<String> names = new ArrayList<>();
        for (ElementType type : values()) {
            names.add(type.wireName);
        }
        return names;
    }
}
