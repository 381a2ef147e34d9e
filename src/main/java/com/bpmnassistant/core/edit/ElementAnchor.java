package com.bpmnassistant.core.edit;

import java.util.Objects;

/**
 * Insertion point next to an existing element: immediately before or after
 * it, in the same sequence.
 */
public final class ElementAnchor {

    public enum Position {
        BEFORE,
        AFTER
    }

    private final Position position;
    private final String   targetId;

    private ElementAnchor(Position position, String targetId) {
        this.position = position;
        this.targetId = Objects.requireNonNull(targetId, "targetId");
    }

    public static ElementAnchor before(String targetId) {
        return new ElementAnchor(Position.BEFORE, targetId);
    }

    public static ElementAnchor after(String targetId) {
        return new ElementAnchor(Position.AFTER, targetId);
    }

    public Position getPosition() {
        return position;
    }

    public String getTargetId() {
        return targetId;
    }

    @Override
    public String toString() {
        return (position == Position.BEFORE ? "before " : "after ") + targetId;
    }
}
