package com.bpmnassistant.core.conversation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One turn of the user-facing conversation that a process is created or
 * edited from. Not to be confused with the oracle's own message history.
 */
public class MessageItem {

    private final MessageRole role;
    private final String content;

    @JsonCreator
    public MessageItem(
            @JsonProperty("role") MessageRole role,
            @JsonProperty("content") String content
    ) {
        this.role = Objects.requireNonNull(role, "role");
        this.content = content != null ? content : "";
    }

    public static MessageItem user(String content) {
        return new MessageItem(MessageRole.USER, content);
    }

    public static MessageItem assistant(String content) {
        return new MessageItem(MessageRole.ASSISTANT, content);
    }

    public MessageRole getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    /** "User: ..." / "Assistant: ..." lines, oldest first. */
    public static String formatHistory(List<MessageItem> history) {
        StringBuilder sb = new StringBuilder();
        for (MessageItem item : history) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(item.role == MessageRole.USER ? "User: " : "Assistant: ")
              .append(item.content);
        }
        return sb.toString();
    }
}
