package com.bpmnassistant.core.edit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * A validated oracle answer: either one edit (verb + arguments) or stop.
 *
 * Only {@link EditProposalValidator} creates non-stop proposals, so the
 * arguments always match the verb's grammar.
 */
public final class EditProposal {

    private static final EditProposal STOP = new EditProposal(null, null);

    private final EditFunction function;
    private final ObjectNode   arguments;

    private EditProposal(EditFunction function, ObjectNode arguments) {
        this.function  = function;
        this.arguments = arguments;
    }

    public static EditProposal stop() {
        return STOP;
    }

    static EditProposal of(EditFunction function, ObjectNode arguments) {
        return new EditProposal(Objects.requireNonNull(function, "function"), arguments.deepCopy());
    }

    public boolean isStop() {
        return function == null;
    }

    /** Null for stop. */
    public EditFunction getFunction() {
        return function;
    }

    /** Null for stop. */
    public ObjectNode getArguments() {
        return arguments;
    }

    String text(String key) {
        return arguments.get(key).asText();
    }

    JsonNode node(String key) {
        return arguments.get(key);
    }

    /** The before_id / after_id argument of an anchored verb. */
    ElementAnchor anchor() {
        return arguments.hasNonNull(EditFunction.BEFORE_ID)
                ? ElementAnchor.before(text(EditFunction.BEFORE_ID))
                : ElementAnchor.after(text(EditFunction.AFTER_ID));
    }

    @Override
    public String toString() {
        return isStop()
                ? "{\"stop\": true}"
                : "{\"function\": \"" + function.getWireName() + "\", \"arguments\": " + arguments + "}";
    }
}
