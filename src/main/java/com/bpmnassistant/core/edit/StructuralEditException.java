package com.bpmnassistant.core.edit;

/**
 * An edit is well-formed but cannot be applied to the current tree:
 * unknown id, duplicate id, or a move into its own subtree.
 */
public class StructuralEditException extends Exception {

    public StructuralEditException(String message) {
        super(message);
    }
}
