package com.bpmnassistant.llm;

import org.springframework.stereotype.Component;

/**
 * Hands out a fresh {@link LLMFacade} (empty history) per conversation.
 */
@Component
public class LLMFacadeFactory {

    private final LLMClient llmClient;

    public LLMFacadeFactory(LLMClient llmClient) {
        this.llmClient = llmClient;
    }

    public LLMFacade create() {
        return new LLMFacade(llmClient);
    }
}
