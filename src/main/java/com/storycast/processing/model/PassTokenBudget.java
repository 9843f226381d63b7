package com.storycast.processing.model;

import com.storycast.processing.BudgetConfigurationException;

import java.util.Objects;

/**
 * Token allocation for one model call: prompt template, input text and generated output.
 * The three parts share a fixed total; a budget that does not fit is rejected on construction.
 */
public final class PassTokenBudget {

    /** Total tokens available to a single model call (prompt + input + output). */
    public static final int TOTAL_TOKEN_BUDGET = 4096;

    /** Fixed characters-per-token ratio used for all estimates. */
    public static final int CHARS_PER_TOKEN = 4;

    private final int promptTokens;
    private final int inputTokens;
    private final int outputTokens;

    public PassTokenBudget(int promptTokens, int inputTokens, int outputTokens) {
        if (promptTokens < 0 || inputTokens < 0 || outputTokens < 0) {
            throw new BudgetConfigurationException(String.format(
                    "Token allocations must not be negative (prompt=%d, input=%d, output=%d)",
                    promptTokens, inputTokens, outputTokens));
        }
        long total = (long) promptTokens + inputTokens + outputTokens;
        if (total > TOTAL_TOKEN_BUDGET) {
            throw new BudgetConfigurationException(String.format(
                    "Total tokens (%d) exceeds budget (%d)", total, TOTAL_TOKEN_BUDGET));
        }
        this.promptTokens = promptTokens;
        this.inputTokens = inputTokens;
        this.outputTokens = outputTokens;
    }

    public int getPromptTokens() {
        return promptTokens;
    }

    public int getInputTokens() {
        return inputTokens;
    }

    public int getOutputTokens() {
        return outputTokens;
    }

    public int getTotalTokens() {
        return promptTokens + inputTokens + outputTokens;
    }

    public int getInputChars() {
        return inputTokens * CHARS_PER_TOKEN;
    }

    public int getOutputChars() {
        return outputTokens * CHARS_PER_TOKEN;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PassTokenBudget)) {
            return false;
        }
        PassTokenBudget that = (PassTokenBudget) o;
        return promptTokens == that.promptTokens
                && inputTokens == that.inputTokens
                && outputTokens == that.outputTokens;
    }

    @Override
    public int hashCode() {
        return Objects.hash(promptTokens, inputTokens, outputTokens);
    }

    @Override
    public String toString() {
        return "PassTokenBudget{prompt=" + promptTokens + ", input=" + inputTokens
                + ", output=" + outputTokens + "}";
    }
}
