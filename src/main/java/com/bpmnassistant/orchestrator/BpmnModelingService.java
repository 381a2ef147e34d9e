package com.bpmnassistant.orchestrator;

import com.bpmnassistant.config.ModelingLimits;
import com.bpmnassistant.core.conversation.MessageItem;
import com.bpmnassistant.core.model.ProcessJsonCodec;
import com.bpmnassistant.core.model.ProcessTree;
import com.bpmnassistant.core.validation.ProcessValidator;
import com.bpmnassistant.core.validation.SchemaViolationException;
import com.bpmnassistant.llm.FacadeException;
import com.bpmnassistant.llm.LLMFacade;
import com.bpmnassistant.orchestrator.RetryBudgetExceededException.Budget;
import com.bpmnassistant.prompt.PromptRenderer;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry points for creating and editing processes.
 */
@Service
public class BpmnModelingService {

    private static final Logger log = LoggerFactory.getLogger(BpmnModelingService.class);

    private final PromptRenderer        promptRenderer;
    private final ProcessValidator      processValidator;
    private final ProcessJsonCodec      codec;
    private final ChangeRequestResolver changeRequestResolver;
    private final BpmnEditorFactory     editorFactory;
    private final ModelingLimits        limits;

    public BpmnModelingService(
            PromptRenderer        promptRenderer,
            ProcessValidator      processValidator,
            ProcessJsonCodec      codec,
            ChangeRequestResolver changeRequestResolver,
            BpmnEditorFactory     editorFactory,
            ModelingLimits        limits
    ) {
        this.promptRenderer        = promptRenderer;
        this.processValidator      = processValidator;
        this.codec                 = codec;
        this.changeRequestResolver = changeRequestResolver;
        this.editorFactory         = editorFactory;
        this.limits                = limits;
    }

    public ProcessTree createBpmn(LLMFacade facade, List<MessageItem> messageHistory) {
        return createBpmn(facade, messageHistory, limits.getCreateMaxRetries());
    }

    /**
     * Generate a whole process, regenerating it from scratch after each
     * invalid answer with the validator's error appended.
     *
     * @throws RetryBudgetExceededException after maxRetries failed attempts
     */
    public ProcessTree createBpmn(LLMFacade facade, List<MessageItem> messageHistory, int maxRetries) {
        String prompt = promptRenderer.render(PromptRenderer.CREATE_BPMN, Map.of(
                "message_history", MessageItem.formatHistory(messageHistory)));

        String lastError = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                JsonNode response = facade.call(prompt);
                JsonNode process  = response.get("process");
                if (process == null) {
                    throw new SchemaViolationException("Response is missing the 'process' key: " + response);
                }
                processValidator.validate(process);

                ProcessTree tree = codec.decode(process);
                log.debug("[Creator] Generated BPMN process:\n{}", codec.toPromptText(tree));
                log.info("[Creator] Process created with {} top-level element(s) (attempt {}/{})",
                        tree.getElements().size(), attempt, maxRetries);
                return tree;

            } catch (FacadeException | SchemaViolationException e) {
                lastError = e.getMessage();
                String errorType = e instanceof FacadeException ? "LLM call failed" : "Invalid process";
                log.warn("[Creator] {} (attempt {}/{}): {}", errorType, attempt, maxRetries, lastError);
                prompt = "Error: " + lastError + ". Try again.";
            }
        }

        RetryBudgetExceededException failure =
                new RetryBudgetExceededException(Budget.PROCESS_GENERATION, maxRetries, lastError);
        log.error("[Creator] {}", failure.getMessage());
        throw failure;
    }

    /**
     * Work out what the user wants changed, then run the edit loop on it.
     *
     * @throws FacadeException when the change request itself cannot be obtained
     * @throws RetryBudgetExceededException when the edit loop gives up
     */
    public ProcessTree editBpmn(LLMFacade facade, ProcessTree process, List<MessageItem> messageHistory)
            throws FacadeException {
        return editWithOutcome(facade, process, messageHistory).getProcess();
    }

    public EditOutcome editWithOutcome(LLMFacade facade, ProcessTree process, List<MessageItem> messageHistory)
            throws FacadeException {
        String changeRequest = changeRequestResolver.define(facade, process, messageHistory);
        return editorFactory.create(facade, process, changeRequest).edit();
    }
}
