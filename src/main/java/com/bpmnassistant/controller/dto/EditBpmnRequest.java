package com.bpmnassistant.controller.dto;

import com.bpmnassistant.core.conversation.MessageItem;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public class EditBpmnRequest {

    /** Raw JSON; validated by the controller before decoding. */
    private final JsonNode process;
    private final List<MessageItem> messageHistory;

    @JsonCreator
    public EditBpmnRequest(
            @JsonProperty("process") JsonNode process,
            @JsonProperty("message_history") List<MessageItem> messageHistory
    ) {
        this.process = process;
        this.messageHistory = messageHistory != null ? List.copyOf(messageHistory) : List.of();
    }

    public JsonNode getProcess() {
        return process;
    }

    public List<MessageItem> getMessageHistory() {
        return messageHistory;
    }
}
