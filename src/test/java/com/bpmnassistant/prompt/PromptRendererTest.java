package com.bpmnassistant.prompt;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptRendererTest {

    private final PromptRenderer renderer = new PromptRenderer();

    @Test
    void testRenderSubstitutesPlaceholders() {
        String prompt = renderer.render(PromptRenderer.EDIT_BPMN, Map.of(
                "process", "[ {\"id\": \"A\"} ]",
                "change_request", "Remove task A"));

        assertTrue(prompt.contains("[ {\"id\": \"A\"} ]"));
        assertTrue(prompt.contains("Remove task A"));
        assertFalse(prompt.contains("{process}"));
        assertFalse(prompt.contains("{change_request}"));
    }

    @Test
    void testReplacementValueIsLiteral() {
        String prompt = renderer.render(PromptRenderer.CREATE_BPMN,
                Map.of("message_history", "User: costs $5 \\ item"));

        assertTrue(prompt.contains("User: costs $5 \\ item"));
    }

    @Test
    void testAllTemplatesLoad() {
        assertTrue(renderer.render(PromptRenderer.EDIT_BPMN_INTERMEDIATE_STEP,
                Map.of("process", "[]")).contains("\"stop\""));
        assertFalse(renderer.render(PromptRenderer.DEFINE_CHANGE_REQUEST,
                Map.of("process", "[]", "message_history", "User: hi")).isBlank());
    }

    @Test
    void testMissingValueFails() {
        assertThrows(IllegalStateException.class,
                () -> renderer.render(PromptRenderer.EDIT_BPMN, Map.of("process", "[]")));
    }

    @Test
    void testUnknownTemplateFails() {
        assertThrows(IllegalStateException.class, () -> renderer.render("no_such_prompt", Map.of()));
    }
}
