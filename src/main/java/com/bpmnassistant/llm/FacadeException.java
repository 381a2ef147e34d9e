package com.bpmnassistant.llm;

/**
 * The oracle call failed or returned content that cannot be used
 * (empty, not JSON, not a JSON object).
 */
public class FacadeException extends Exception {

    public FacadeException(String message) {
        super(message);
    }

    public FacadeException(String message, Throwable cause) {
        super(message, cause);
    }
}
