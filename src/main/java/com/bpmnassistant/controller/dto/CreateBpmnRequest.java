package com.bpmnassistant.controller.dto;

import com.bpmnassistant.core.conversation.MessageItem;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class CreateBpmnRequest {

    private final List<MessageItem> messageHistory;

    @JsonCreator
    public CreateBpmnRequest(@JsonProperty("message_history") List<MessageItem> messageHistory) {
        this.messageHistory = messageHistory != null ? List.copyOf(messageHistory) : List.of();
    }

    public List<MessageItem> getMessageHistory() {
        return messageHistory;
    }
}
