package com.bpmnassistant.core.edit;

import com.bpmnassistant.core.validation.SchemaViolationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Checks an oracle answer against the edit grammar.
 *
 *   {"function": verb, "arguments": {...}}   arguments match the verb exactly
 *   {"stop": ...}                             only when acceptStop is true
 *
 * Id-like arguments must be non-empty strings; element arguments must be
 * objects. Whether the ids exist is not checked here; that is the edit
 * library's job.
 */
@Component
public class EditProposalValidator {

    private static final Set<String> ID_KEYS =
            Set.of("element_id", "before_id", "after_id", "next_id", "branch_condition");
    private static final Set<String> ELEMENT_KEYS = Set.of("element", "new_element");

    public EditProposal validate(JsonNode response, boolean acceptStop) throws SchemaViolationException {
        if (response == null || !response.isObject()) {
            throw new SchemaViolationException("Edit proposal must be a JSON object, got: " + response);
        }

        if (response.has("stop")) {
            if (!acceptStop) {
                throw new SchemaViolationException(
                        "A 'stop' signal is not accepted for the first edit. "
                        + "Provide an edit with 'function' and 'arguments' keys.");
            }
            return EditProposal.stop();
        }

        if (!response.has("function") || !response.has("arguments")) {
            throw new SchemaViolationException(
                    "Function call should contain 'function' and 'arguments' keys, or a 'stop' key.");
        }

        JsonNode functionNode = response.get("function");
        EditFunction function = functionNode.isTextual()
                ? EditFunction.fromWireName(functionNode.asText()).orElse(null)
                : null;
        if (function == null) {
            String name = functionNode.isTextual() ? functionNode.asText() : functionNode.toString();
            throw new SchemaViolationException("Function '" + name + "' not found. Supported functions: " + EditFunction.wireNames());
        }

        JsonNode arguments = response.get("arguments");
        if (!arguments.isObject()) {
            throw new SchemaViolationException(
                    "Arguments of '" + function.getWireName() + "' should be a JSON object with "
                    + function.describeArguments() + " keys.");
        }

        validateArguments(function, (ObjectNode) arguments);
        return EditProposal.of(function, (ObjectNode) arguments);
    }

    private void validateArguments(EditFunction function, ObjectNode arguments) throws SchemaViolationException {
        String verb = function.getWireName();

        for (String key : function.getRequiredKeys()) {
            if (!arguments.has(key)) {
                throw new SchemaViolationException("Arguments of '" + verb + "' should contain '" + key
                        + "' key. Expected " + function.describeArguments() + ".");
            }
        }

        if (function.isAnchored()) {
            boolean before = arguments.has(EditFunction.BEFORE_ID);
            boolean after  = arguments.has(EditFunction.AFTER_ID);
            if (before && after) {
                throw new SchemaViolationException("Only one of 'before_id' and 'after_id' should be provided for '"
                        + verb + "'.");
            }
            if (!before && !after) {
                throw new SchemaViolationException("Either 'before_id' or 'after_id' should be provided for '"
                        + verb + "'.");
            }
        }

        List<String> unexpected = new ArrayList<>();
        Iterator<String> names = arguments.fieldNames();
        while (names.hasNext()) {
            String key = names.next();
            boolean allowed = function.getRequiredKeys().contains(key)
                    || (function.isAnchored()
                        && (key.equals(EditFunction.BEFORE_ID) || key.equals(EditFunction.AFTER_ID)));
            if (!allowed) {
                unexpected.add(key);
            }
        }
        if (!unexpected.isEmpty()) {
            throw new SchemaViolationException("Arguments of '" + verb + "' should contain only "
                    + function.describeArguments() + " keys. Unexpected: " + unexpected + ".");
        }

        Iterator<String> present = arguments.fieldNames();
        while (present.hasNext()) {
            String key = present.next();
            JsonNode value = arguments.get(key);
            if (ID_KEYS.contains(key) && (!value.isTextual() || value.asText().isBlank())) {
                throw new SchemaViolationException("Argument '" + key + "' of '" + verb
                        + "' should be a non-empty string, got: " + value);
            }
            if (ELEMENT_KEYS.contains(key) && !value.isObject()) {
                throw new SchemaViolationException("Argument '" + key + "' of '" + verb
                        + "' should be an element object, got: " + value);
            }
        }
    }
}
