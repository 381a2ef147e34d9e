package com.bpmnassistant.core.validation;

/**
 * A process tree or an edit proposal breaks the grammar.
 *
 * Recoverable: the message is fed back to the oracle verbatim, so it must
 * name the offending element or verb and the rule it breaks.
 */
public class SchemaViolationException extends Exception {

    public SchemaViolationException(String message) {
        super(message);
    }
}
