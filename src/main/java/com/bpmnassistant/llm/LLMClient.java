package com.bpmnassistant.llm;

import java.util.List;

/**
 * LLMClient: single interface for every oracle backend.
 *
 * ONE method contract: generate(List, OutputMode, double).
 * generate(String) is a convenience default for one-off text prompts.
 *
 * getTemperatureFor(OutputMode) is a default method so the canonical
 * temperatures live here, not in each backend.
 */
public interface LLMClient {

    /**
     * Primary generation method.
     *
     * @param messages    Full conversation, oldest first. A leading SYSTEM message is optional.
     * @param outputMode  JSON asks the backend for a JSON object; TEXT for free text.
     * @param temperature Sampling temperature (0.0 = deterministic, 1.0 = creative).
     * @return Raw model output. Never null; empty string on empty model output.
     */
    String generate(List<ChatMessage> messages, OutputMode outputMode, double temperature);

    /**
     * Convenience wrapper for a single text prompt with no conversation.
     * DO NOT override.
     */
    default String generate(String prompt) {
        return generate(List.of(ChatMessage.user(prompt)), OutputMode.TEXT,
                getTemperatureFor(OutputMode.TEXT));
    }

    /**
     * JSON  0.2: edit proposals and process trees; low creativity
     * TEXT  0.5: change-request summaries
     */
    default double getTemperatureFor(OutputMode outputMode) {
        return switch (outputMode) {
            case JSON -> 0.2;
            case TEXT -> 0.5;
        };
    }
}
