package com.storycast.processing.model;

import com.storycast.processing.BudgetConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PassTokenBudgetTest {

    @Test
    void testDerivedValues() {
        PassTokenBudget budget = new PassTokenBudget(200, 1000, 500);

        assertThat(budget.getTotalTokens()).isEqualTo(1700);
        assertThat(budget.getInputChars()).isEqualTo(4000);
        assertThat(budget.getOutputChars()).isEqualTo(2000);
    }

    @Test
    void testBudgetFillingTheWholeWindowIsAccepted() {
        PassTokenBudget budget = new PassTokenBudget(96, 3000, 1000);

        assertThat(budget.getTotalTokens()).isEqualTo(PassTokenBudget.TOTAL_TOKEN_BUDGET);
    }

    @Test
    void testBudgetOverTotalIsRejected() {
        assertThatThrownBy(() -> new PassTokenBudget(2000, 2000, 2000))
                .isInstanceOf(BudgetConfigurationException.class)
                .hasMessageContaining("6000")
                .hasMessageContaining("4096");
        assertThatThrownBy(() -> new PassTokenBudget(97, 3000, 1000))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testNegativeAllocationIsRejected() {
        assertThatThrownBy(() -> new PassTokenBudget(-1, 100, 100))
                .isInstanceOf(BudgetConfigurationException.class);
    }
}
