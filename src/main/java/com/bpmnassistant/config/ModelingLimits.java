package com.bpmnassistant.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Retry budgets for process creation and editing.
 *
 * Every budget is a hard ceiling: the orchestrators never call the oracle
 * more often than these numbers allow.
 */
@Component
public class ModelingLimits {

    private final int createMaxRetries;
    private final int maxProposalAttempts;
    private final int maxApplyAttempts;
    private final int maxIntermediateRounds;

    public ModelingLimits(
            @Value("${bpmn.create.max-retries:3}") int createMaxRetries,
            @Value("${bpmn.edit.max-proposal-attempts:3}") int maxProposalAttempts,
            @Value("${bpmn.edit.max-apply-attempts:3}") int maxApplyAttempts,
            @Value("${bpmn.edit.max-intermediate-rounds:7}") int maxIntermediateRounds
    ) {
        this.createMaxRetries      = requirePositive("bpmn.create.max-retries", createMaxRetries);
        this.maxProposalAttempts   = requirePositive("bpmn.edit.max-proposal-attempts", maxProposalAttempts);
        this.maxApplyAttempts      = requirePositive("bpmn.edit.max-apply-attempts", maxApplyAttempts);
        this.maxIntermediateRounds = requirePositive("bpmn.edit.max-intermediate-rounds", maxIntermediateRounds);
    }

    public static ModelingLimits defaults() {
        return new ModelingLimits(3, 3, 3, 7);
    }

    public int getCreateMaxRetries() {
        return createMaxRetries;
    }

    public int getMaxProposalAttempts() {
        return maxProposalAttempts;
    }

    public int getMaxApplyAttempts() {
        return maxApplyAttempts;
    }

    public int getMaxIntermediateRounds() {
        return maxIntermediateRounds;
    }

    private static int requirePositive(String property, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(property + " must be at least 1, got " + value);
        }
        return value;
    }
}
