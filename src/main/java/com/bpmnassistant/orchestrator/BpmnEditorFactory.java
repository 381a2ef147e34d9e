package com.bpmnassistant.orchestrator;

import com.bpmnassistant.config.ModelingLimits;
import com.bpmnassistant.core.edit.EditFunctionLibrary;
import com.bpmnassistant.core.edit.EditProposalValidator;
import com.bpmnassistant.core.model.ProcessJsonCodec;
import com.bpmnassistant.core.model.ProcessTree;
import com.bpmnassistant.core.validation.ProcessValidator;
import com.bpmnassistant.llm.LLMFacade;
import com.bpmnassistant.prompt.PromptRenderer;
import org.springframework.stereotype.Component;

@Component
public class BpmnEditorFactory {

    private final PromptRenderer        promptRenderer;
    private final EditProposalValidator proposalValidator;
    private final EditFunctionLibrary   functionLibrary;
    private final ProcessValidator      processValidator;
    private final ProcessJsonCodec      codec;
    private final ModelingLimits        limits;

    public BpmnEditorFactory(
            PromptRenderer        promptRenderer,
            EditProposalValidator proposalValidator,
            EditFunctionLibrary   functionLibrary,
            ProcessValidator      processValidator,
            ProcessJsonCodec      codec,
            ModelingLimits        limits
    ) {
        this.promptRenderer    = promptRenderer;
        this.proposalValidator = proposalValidator;
        this.functionLibrary   = functionLibrary;
        this.processValidator  = processValidator;
        this.codec             = codec;
        this.limits            = limits;
    }

    public BpmnEditorService create(LLMFacade facade, ProcessTree process, String changeRequest) {
        return new BpmnEditorService(facade, process, changeRequest, promptRenderer,
                proposalValidator, functionLibrary, processValidator, codec, limits);
    }
}
