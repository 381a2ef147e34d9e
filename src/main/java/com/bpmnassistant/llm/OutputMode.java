package com.bpmnassistant.llm;

/**
 * How the oracle is asked to answer.
 *
 * JSON: a single JSON object, parsed by {@link LLMFacade#call(String)}
 * TEXT: free text, returned as is by {@link LLMFacade#callText(String)}
 */
public enum OutputMode {
    JSON,
    TEXT
}
