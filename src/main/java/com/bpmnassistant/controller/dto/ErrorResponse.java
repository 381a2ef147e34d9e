package com.bpmnassistant.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private final String error;
    private final String budget;

    public ErrorResponse(String error, String budget) {
        this.error = error;
        this.budget = budget;
    }

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }

    public String getError() {
        return error;
    }

    /** Exhausted budget, when the failure is a RetryBudgetExceededException. */
    public String getBudget() {
        return budget;
    }
}
