package com.bpmnassistant.orchestrator;

/**
 * Terminal failure: one of the retry budgets ran out. Never retried.
 */
public class RetryBudgetExceededException extends RuntimeException {

    public enum Budget {
        PROCESS_GENERATION("process generation"),
        PROPOSAL_GRAMMAR("edit proposal grammar"),
        STRUCTURAL_APPLY("structural apply"),
        ITERATION_COUNT("iteration count");

        private final String description;

        Budget(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Budget budget;
    private final int limit;
    private final String lastError;

    public RetryBudgetExceededException(Budget budget, int limit, String lastError) {
        super(buildMessage(budget, limit, lastError));
        this.budget = budget;
        this.limit = limit;
        this.lastError = lastError;
    }

    public Budget getBudget() {
        return budget;
    }

    public int getLimit() {
        return limit;
    }

    /** Last recoverable error seen before giving up; null for ITERATION_COUNT. */
    public String getLastError() {
        return lastError;
    }

    private static String buildMessage(Budget budget, int limit, String lastError) {
        String unit = budget == Budget.ITERATION_COUNT ? " rounds" : " attempts";
        String message = "Max number of " + budget.getDescription() + " retries reached ("
                + limit + unit + ").";
        return lastError != null ? message + " Last error: " + lastError : message;
    }
}
