package com.bpmnassistant.orchestrator;

/**
 * States of the edit loop.
 *
 *   INIT → AWAITING_INITIAL_PROPOSAL → APPLY_INITIAL
 *        → AWAITING_INTERMEDIATE_PROPOSAL ⇄ APPLY_INTERMEDIATE
 *        → STOPPED | FAILED
 *
 * AWAITING_*   ask the oracle for a proposal, retrying grammar failures
 * APPLY_*      run the transform, retrying structural failures
 * STOPPED      the oracle said stop; the current tree is the result
 * FAILED       a budget ran out; RetryBudgetExceededException is thrown
 */
public enum EditState {
    INIT,
    AWAITING_INITIAL_PROPOSAL,
    APPLY_INITIAL,
    AWAITING_INTERMEDIATE_PROPOSAL,
    APPLY_INTERMEDIATE,
    STOPPED,
    FAILED;

    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
