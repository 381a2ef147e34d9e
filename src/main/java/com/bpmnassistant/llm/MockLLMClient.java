package com.bpmnassistant.llm;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Deterministic stand-in for local runs. Answers by the wording of the
 * latest user message: creation prompts get a two-task process, the first
 * edit prompt gets a relabel of {@code task_1}, everything else gets stop.
 */
@Component
@Profile("mock")
public class MockLLMClient implements LLMClient {

    static final String CHANGE_REQUEST = "Rename the first task to 'Review request (revised)'.";

    @Override
    public String generate(List<ChatMessage> messages, OutputMode outputMode, double temperature) {
        if (outputMode == OutputMode.TEXT) {
            return CHANGE_REQUEST;
        }

        String prompt = messages.isEmpty() ? "" : messages.get(messages.size() - 1).getContent();

        if (prompt.startsWith("Create a BPMN process")) {
            return """
                    {
                      "process": [
                        { "type": "userTask", "id": "task_1", "label": "Review request" },
                        { "type": "serviceTask", "id": "task_2", "label": "Notify requester" }
                      ]
                    }
                    """;
        }

        if (prompt.startsWith("Propose the first edit")) {
            return """
                    {
                      "function": "update_element",
                      "arguments": {
                        "new_element": { "type": "userTask", "id": "task_1", "label": "Review request (revised)" }
                      }
                    }
                    """;
        }

        return "{\"stop\": true}";
    }
}
