package com.bpmnassistant.orchestrator;

import com.bpmnassistant.core.model.ProcessTree;

public class EditOutcome {

    private final ProcessTree process;
    private final EditState finalState;
    private final int intermediateRounds;
    private final int oracleCalls;

    public EditOutcome(ProcessTree process, EditState finalState, int intermediateRounds, int oracleCalls) {
        this.process = process;
        this.finalState = finalState;
        this.intermediateRounds = intermediateRounds;
        this.oracleCalls = oracleCalls;
    }

    public ProcessTree getProcess() {
        return process;
    }

    public EditState getFinalState() {
        return finalState;
    }

    /** Intermediate rounds started, including the one that ended in stop. */
    public int getIntermediateRounds() {
        return intermediateRounds;
    }

    public int getOracleCalls() {
        return oracleCalls;
    }
}
