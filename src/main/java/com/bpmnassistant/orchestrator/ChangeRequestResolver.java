package com.bpmnassistant.orchestrator;

import com.bpmnassistant.core.conversation.MessageItem;
import com.bpmnassistant.core.model.ProcessJsonCodec;
import com.bpmnassistant.core.model.ProcessTree;
import com.bpmnassistant.llm.FacadeException;
import com.bpmnassistant.llm.LLMFacade;
import com.bpmnassistant.prompt.PromptRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Turns the conversation into one explicit change request for the editor.
 */
@Component
public class ChangeRequestResolver {

    private static final Logger log = LoggerFactory.getLogger(ChangeRequestResolver.class);

    private final PromptRenderer   promptRenderer;
    private final ProcessJsonCodec codec;

    public ChangeRequestResolver(PromptRenderer promptRenderer, ProcessJsonCodec codec) {
        this.promptRenderer = promptRenderer;
        this.codec          = codec;
    }

    public String define(LLMFacade facade, ProcessTree process, List<MessageItem> messageHistory)
            throws FacadeException {
        String prompt = promptRenderer.render(PromptRenderer.DEFINE_CHANGE_REQUEST, Map.of(
                "process", codec.toPromptText(process),
                "message_history", MessageItem.formatHistory(messageHistory)));

        String changeRequest = facade.callText(prompt);
        log.info("[ChangeRequest] {}", changeRequest);
        return changeRequest;
    }
}
