package com.bpmnassistant.core.edit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The five edit verbs and their argument grammar.
 *
 * {@code requiredKeys} must all be present. Anchored verbs additionally take
 * exactly one of {@code before_id} / {@code after_id}. No other key is allowed.
 */
public enum EditFunction {
    DELETE_ELEMENT("delete_element", Set.of("element_id"), false),
    REDIRECT_BRANCH("redirect_branch", Set.of("branch_condition", "next_id"), false),
    ADD_ELEMENT("add_element", Set.of("element"), true),
    MOVE_ELEMENT("move_element", Set.of("element_id"), true),
    UPDATE_ELEMENT("update_element", Set.of("new_element"), false);

    public static final String BEFORE_ID = "before_id";
    public static final String AFTER_ID  = "after_id";

    private final String      wireName;
    private final Set<String> requiredKeys;
    private final boolean     anchored;

    EditFunction(String wireName, Set<String> requiredKeys, boolean anchored) {
        this.wireName     = wireName;
        this.requiredKeys = requiredKeys;
        this.anchored     = anchored;
    }

    public String getWireName() {
        return wireName;
    }

    public Set<String> getRequiredKeys() {
        return requiredKeys;
    }

    /** Whether the verb takes exactly one of before_id / after_id. */
    public boolean isAnchored() {
        return anchored;
    }

    /** Human-readable argument shape, used in feedback to the oracle. */
    public String describeArguments() {
        List<String> keys = new ArrayList<>(requiredKeys);
        keys.sort(null);
        String required = String.join("', '", keys);
        return anchored
                ? "'" + required + "' and exactly one of '" + BEFORE_ID + "' or '" + AFTER_ID + "'"
                : "'" + required + "'";
    }

    public static Optional<EditFunction> fromWireName(String wireName) {
        for (EditFunction function : values()) {
            if (function.wireName.equals(wireName)) {
                return Optional.of(function);
            }
        }
        return Optional.empty();
    }

    public static List<String> wireNames() {
        List<String> names = new ArrayList<>();
        for (EditFunction function : values()) {
            names.add(function.wireName);
        }
        return names;
    }
}
