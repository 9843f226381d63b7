package com.storycast.processing;

/**
 * A token budget that cannot fit in a model call. Raised at construction and never retried.
 */
public class BudgetConfigurationException extends IllegalStateException {

    public BudgetConfigurationException(String message) {
        super(message);
    }
}
