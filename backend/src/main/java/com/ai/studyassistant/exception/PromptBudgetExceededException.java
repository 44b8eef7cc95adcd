package com.ai.studyassistant.exception;

/**
 * Thrown when the question and instructions alone do not fit the prompt budget.
 */
public class PromptBudgetExceededException extends RagException {

    public PromptBudgetExceededException(int required, int budget) {
        super("Prompt needs " + required + " characters but the budget is " + budget);
    }
}
