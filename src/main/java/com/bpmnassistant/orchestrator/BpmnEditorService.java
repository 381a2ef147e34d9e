package com.bpmnassistant.orchestrator;

import com.bpmnassistant.config.ModelingLimits;
import com.bpmnassistant.core.edit.EditFunctionLibrary;
import com.bpmnassistant.core.edit.EditProposal;
import com.bpmnassistant.core.edit.EditProposalValidator;
import com.bpmnassistant.core.edit.StructuralEditException;
import com.bpmnassistant.core.model.ProcessJsonCodec;
import com.bpmnassistant.core.model.ProcessTree;
import com.bpmnassistant.core.validation.ProcessValidator;
import com.bpmnassistant.core.validation.SchemaViolationException;
import com.bpmnassistant.llm.FacadeException;
import com.bpmnassistant.llm.LLMFacade;
import com.bpmnassistant.prompt.PromptRenderer;
import com.bpmnassistant.orchestrator.RetryBudgetExceededException.Budget;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * BpmnEditorService: drives one change request to completion.
 *
 * State flow (see {@link EditState}):
 *   one initial edit, then up to maxIntermediateRounds further edits until
 *   the oracle answers stop.
 *
 * Three independent budgets, all hard ceilings:
 *   proposal grammar   maxProposalAttempts per proposal request
 *   structural apply   maxApplyAttempts per proposal
 *   iteration count    maxIntermediateRounds
 *
 * Oracle failures (FacadeException) count exactly like the validation
 * failure of the layer that made the call.
 *
 * One instance per change request; holds the oracle conversation. Obtain
 * through {@link BpmnEditorFactory}.
 */
public class BpmnEditorService {

    private static final Logger log = LoggerFactory.getLogger(BpmnEditorService.class);

    private final LLMFacade             facade;
    private final ProcessTree           process;
    private final String                changeRequest;
    private final PromptRenderer        promptRenderer;
    private final EditProposalValidator proposalValidator;
    private final EditFunctionLibrary   functionLibrary;
    private final ProcessValidator      processValidator;
    private final ProcessJsonCodec      codec;
    private final ModelingLimits        limits;

    private EditState state = EditState.INIT;

    BpmnEditorService(
            LLMFacade             facade,
            ProcessTree           process,
            String                changeRequest,
            PromptRenderer        promptRenderer,
            EditProposalValidator proposalValidator,
            EditFunctionLibrary   functionLibrary,
            ProcessValidator      processValidator,
            ProcessJsonCodec      codec,
            ModelingLimits        limits
    ) {
        this.facade            = facade;
        this.process           = process;
        this.changeRequest     = changeRequest;
        this.promptRenderer    = promptRenderer;
        this.proposalValidator = proposalValidator;
        this.functionLibrary   = functionLibrary;
        this.processValidator  = processValidator;
        this.codec             = codec;
        this.limits            = limits;
    }

    /** Run the loop and return the edited process. */
    public ProcessTree editBpmn() {
        return edit().getProcess();
    }

    /**
     * Run the loop to a terminal state.
     *
     * @throws RetryBudgetExceededException when any budget runs out (state FAILED)
     */
    public EditOutcome edit() {
        if (state != EditState.INIT) {
            throw new IllegalStateException("Editor already ran; create a new one per change request");
        }

        log.info("[Editor] Change request: {}", changeRequest);

        ProcessTree  current = process;
        EditProposal pending = null;
        int          rounds  = 0;

        while (!state.isTerminal()) {
            switch (state) {
                case INIT -> transition(EditState.AWAITING_INITIAL_PROPOSAL);

                case AWAITING_INITIAL_PROPOSAL -> {
                    pending = requestProposal(initialPrompt(), false);
                    log.info("[Editor] Initial edit proposal: {}", pending);
                    transition(EditState.APPLY_INITIAL);
                }

                case APPLY_INITIAL -> {
                    current = applyWithRetries(current, pending);
                    transition(EditState.AWAITING_INTERMEDIATE_PROPOSAL);
                }

                case AWAITING_INTERMEDIATE_PROPOSAL -> {
                    if (rounds >= limits.getMaxIntermediateRounds()) {
                        throw fail(new RetryBudgetExceededException(
                                Budget.ITERATION_COUNT, limits.getMaxIntermediateRounds(), null));
                    }
                    rounds++;
                    log.info("[Editor] Intermediate round {}/{}", rounds, limits.getMaxIntermediateRounds());

                    pending = requestProposal(intermediatePrompt(current), true);
                    log.info("[Editor] Intermediate edit proposal: {}", pending);

                    if (pending.isStop()) {
                        log.info("[Editor] Edit process stopped.");
                        transition(EditState.STOPPED);
                    } else {
                        transition(EditState.APPLY_INTERMEDIATE);
                    }
                }

                case APPLY_INTERMEDIATE -> {
                    current = applyWithRetries(current, pending);
                    transition(EditState.AWAITING_INTERMEDIATE_PROPOSAL);
                }

                default -> throw new IllegalStateException("Unexpected state " + state);
            }
        }

        log.info("[Editor] Finished in state {} after {} intermediate round(s), {} oracle call(s)",
                state, rounds, facade.getCallCount());
        return new EditOutcome(current, state, rounds, facade.getCallCount());
    }

    public EditState getState() {
        return state;
    }

    // =========================================================================
    // PROPOSAL LAYER
    // =========================================================================

    /**
     * Ask for a proposal until one passes the grammar, feeding each error
     * back. The first prompt is the full template; retries are short
     * follow-ups in the same conversation.
     */
    private EditProposal requestProposal(String firstPrompt, boolean acceptStop) {
        int    maxAttempts = limits.getMaxProposalAttempts();
        String prompt      = firstPrompt;
        String lastError   = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                JsonNode response = facade.call(prompt);
                log.debug("[Editor] Raw proposal (attempt {}/{}): {}", attempt, maxAttempts, response);
                return proposalValidator.validate(response, acceptStop);
            } catch (FacadeException | SchemaViolationException e) {
                lastError = e.getMessage();
                log.warn("[Editor] Validation error (attempt {}/{}): {}", attempt, maxAttempts, lastError);
                prompt = "Editing error: " + lastError + ". Please provide a new edit proposal.";
            }
        }

        throw fail(new RetryBudgetExceededException(Budget.PROPOSAL_GRAMMAR, maxAttempts, lastError));
    }

    // =========================================================================
    // APPLY LAYER
    // =========================================================================

    /**
     * Apply the proposal, asking for a replacement after each structural
     * failure. A replacement that is stop abandons this edit and keeps the
     * tree as it was before it. A replacement that is unusable (oracle error
     * or bad grammar) uses up the next attempt without touching the tree.
     */
    private ProcessTree applyWithRetries(ProcessTree before, EditProposal proposal) {
        int          maxAttempts = limits.getMaxApplyAttempts();
        EditProposal candidate   = proposal;
        String       lastError   = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (candidate != null) {
                try {
                    ProcessTree updated = applyAndVerify(before, candidate);
                    log.info("[Editor] Applied {} (attempt {}/{})",
                            candidate.getFunction().getWireName(), attempt, maxAttempts);
                    return updated;
                } catch (StructuralEditException e) {
                    lastError = e.getMessage();
                }
            }

            log.warn("[Editor] Apply failed (attempt {}/{}): {}", attempt, maxAttempts, lastError);

            if (attempt == maxAttempts) {
                break;
            }

            candidate = null;
            try {
                JsonNode response = facade.call(
                        "Error: " + lastError + ". Try again. Change request: " + changeRequest);
                candidate = proposalValidator.validate(response, true);
                log.info("[Editor] New edit proposal: {}", candidate);

                if (candidate.isStop()) {
                    log.info("[Editor] Stop received while retrying; keeping the tree from before this edit");
                    return before;
                }
            } catch (FacadeException | SchemaViolationException e) {
                lastError = e.getMessage();
            }
        }

        throw fail(new RetryBudgetExceededException(Budget.STRUCTURAL_APPLY, maxAttempts, lastError));
    }

    /**
     * Run the transform, then re-check the whole resulting tree so a
     * transform can never hand back a tree that breaks the grammar.
     */
    private ProcessTree applyAndVerify(ProcessTree before, EditProposal proposal) throws StructuralEditException {
        ProcessTree updated = functionLibrary.apply(before, proposal);
        try {
            processValidator.validate(codec.encode(updated));
        } catch (SchemaViolationException e) {
            throw new StructuralEditException("The edit produces an invalid process: " + e.getMessage());
        }
        return updated;
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private String initialPrompt() {
        return promptRenderer.render(PromptRenderer.EDIT_BPMN, Map.of(
                "process", codec.toPromptText(process),
                "change_request", changeRequest));
    }

    private String intermediatePrompt(ProcessTree current) {
        return promptRenderer.render(PromptRenderer.EDIT_BPMN_INTERMEDIATE_STEP, Map.of(
                "process", codec.toPromptText(current)));
    }

    private void transition(EditState next) {
        log.debug("[Editor] Transition: {} → {}", state, next);
        state = next;
    }

    private RetryBudgetExceededException fail(RetryBudgetExceededException e) {
        transition(EditState.FAILED);
        log.error("[Editor] {}", e.getMessage());
        return e;
    }
}
