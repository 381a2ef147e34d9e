package com.bpmnassistant.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * LLMFacade: one conversation with the oracle.
 *
 * Keeps the message history so that short follow-up prompts
 * ("Editing error: ... Please provide a new edit proposal.") are read in
 * the context of everything asked before. One instance per orchestration;
 * never shared.
 *
 * Every failure surfaces as {@link FacadeException}: backend errors, empty
 * output, output that is not JSON, or JSON that is not an object.
 */
public class LLMFacade {

    private static final Logger       log    = LoggerFactory.getLogger(LLMFacade.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String SYSTEM_PROMPT =
            "You are a BPMN modeling assistant. When asked for JSON, respond with a single "
            + "JSON object and nothing else.";

    private final LLMClient         client;
    private final List<ChatMessage> messages = new ArrayList<>();
    private int                     callCount;

    public LLMFacade(LLMClient client) {
        this.client = client;
        this.messages.add(ChatMessage.system(SYSTEM_PROMPT));
    }

    /**
     * Ask for a JSON object.
     *
     * Strips markdown fences and leading prose before parsing.
     */
    public JsonNode call(String prompt) throws FacadeException {
        String raw = exchange(prompt, OutputMode.JSON);
        return parseObject(raw);
    }

    /** Ask for free text. Blank output is a failure. */
    public String callText(String prompt) throws FacadeException {
        return exchange(prompt, OutputMode.TEXT).trim();
    }

    public List<ChatMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    /** Number of oracle calls made, successful or not. */
    public int getCallCount() {
        return callCount;
    }

    private String exchange(String prompt, OutputMode mode) throws FacadeException {
        callCount++;
        messages.add(ChatMessage.user(prompt));

        String raw;
        try {
            raw = client.generate(List.copyOf(messages), mode, client.getTemperatureFor(mode));
        } catch (RuntimeException e) {
            // keep user/assistant turns alternating for the next prompt
            messages.remove(messages.size() - 1);
            log.warn("[Facade] Oracle call #{} failed: {}", callCount, e.getMessage());
            throw new FacadeException("Oracle call failed: " + e.getMessage(), e);
        }

        if (raw == null || raw.isBlank()) {
            messages.remove(messages.size() - 1);
            log.warn("[Facade] Oracle call #{} returned empty output", callCount);
            throw new FacadeException("Empty response from oracle");
        }

        messages.add(ChatMessage.assistant(raw));
        log.debug("[Facade] Call #{} ({}) responseLen={}", callCount, mode, raw.length());
        return raw;
    }

    static JsonNode parseObject(String raw) throws FacadeException {
        String cleaned = raw.trim();

        // Strip markdown fences
        if (cleaned.startsWith("```")) {
            int start = cleaned.indexOf('\n') + 1;
            int end   = cleaned.lastIndexOf("```");
            if (start > 0 && end > start) cleaned = cleaned.substring(start, end).trim();
        }

        // Skip leading prose to first '{'
        int jsonStart = cleaned.indexOf('{');
        if (jsonStart > 0) cleaned = cleaned.substring(jsonStart);

        JsonNode root;
        try {
            root = MAPPER.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.error("[Facade] Invalid JSON response: {}", raw);
            throw new FacadeException("Invalid JSON response: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new FacadeException("Expected a JSON object but got: " + raw.trim());
        }
        return root;
    }
}
