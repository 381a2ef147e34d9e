package com.bpmnassistant.core.conversation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageItemTest {

    @Test
    void testFormatHistory() {
        String formatted = MessageItem.formatHistory(List.of(
                MessageItem.user("Add an approval step"),
                MessageItem.assistant("Before or after the review?"),
                MessageItem.user("After")));

        assertEquals("""
                User: Add an approval step
                Assistant: Before or after the review?
                User: After""", formatted);
    }

    @Test
    void testEmptyHistoryFormatsToEmptyString() {
        assertEquals("", MessageItem.formatHistory(List.of()));
    }

    @Test
    void testReadsWireRoles() throws Exception {
        MessageItem item = new ObjectMapper().readValue(
                "{\"role\": \"assistant\", \"content\": \"Done\"}", MessageItem.class);

        assertEquals(MessageRole.ASSISTANT, item.getRole());
        assertEquals("Done", item.getContent());
    }

    @Test
    void testUnknownRoleRejected() {
        assertThrows(IllegalArgumentException.class, () -> MessageRole.fromWireName("system"));
    }
}
