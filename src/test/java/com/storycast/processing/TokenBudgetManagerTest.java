package com.storycast.processing;

import com.storycast.processing.model.PassTokenBudget;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TokenBudgetManagerTest {

    private static final PassTokenBudget HUNDRED_CHAR_INPUT = new PassTokenBudget(100, 25, 100);

    @Test
    void testEstimateTokens() {
        assertThat(TokenBudgetManager.estimateTokens("A".repeat(100))).isEqualTo(25);
        assertThat(TokenBudgetManager.estimateTokens("abc")).isEqualTo(1);
        assertThat(TokenBudgetManager.estimateTokens("abcd")).isEqualTo(1);
        assertThat(TokenBudgetManager.estimateTokens("abcde")).isEqualTo(2);
        assertThat(TokenBudgetManager.estimateTokens("")).isZero();
        assertThat(TokenBudgetManager.estimateTokens(null)).isZero();
    }

    @Test
    void testFitsWithinTokens() {
        assertThat(TokenBudgetManager.fitsWithinTokens("Short", 10)).isTrue();
        assertThat(TokenBudgetManager.fitsWithinTokens("A".repeat(40), 10)).isTrue();
        assertThat(TokenBudgetManager.fitsWithinTokens("A".repeat(41), 10)).isFalse();
    }

    @Test
    void testPredefinedBudgetsFitTotal() {
        for (PassTokenBudget budget : List.of(TokenBudgetManager.CHARACTER_EXTRACTION,
                TokenBudgetManager.DIALOG_EXTRACTION, TokenBudgetManager.VOICE_PROFILE,
                TokenBudgetManager.BATCHED_ANALYSIS)) {
            assertThat(budget.getTotalTokens()).isLessThanOrEqualTo(TokenBudgetManager.TOTAL_TOKEN_BUDGET);
        }
        assertThat(TokenBudgetManager.DIALOG_EXTRACTION.getOutputTokens())
                .isGreaterThan(TokenBudgetManager.CHARACTER_EXTRACTION.getOutputTokens());
    }

    @Test
    void testPrepareInputTextReturnsTextThatFits() {
        String text = "A short paragraph.";
        assertThat(TokenBudgetManager.prepareInputText(text, HUNDRED_CHAR_INPUT)).isSameAs(text);

        String exact = "B".repeat(100);
        assertThat(TokenBudgetManager.prepareInputText(exact, HUNDRED_CHAR_INPUT)).isSameAs(exact);
    }

    @Test
    void testPrepareInputTextCutsAtParagraphBoundary() {
        String first = "a".repeat(70);
        String text = first + "\n\n" + "b".repeat(100);

        String prepared = TokenBudgetManager.prepareInputText(text, HUNDRED_CHAR_INPUT);

        assertThat(prepared).isEqualTo(first);
    }

    @Test
    void testPrepareInputTextFallsBackToSentenceBoundary() {
        String sentence = "x".repeat(60) + ".";
        String text = sentence + " " + "y".repeat(100);

        String prepared = TokenBudgetManager.prepareInputText(text, HUNDRED_CHAR_INPUT);

        assertThat(prepared).isEqualTo(sentence);
    }

    @Test
    void testPrepareInputTextFallsBackToWordBoundary() {
        String text = "word ".repeat(40);

        String prepared = TokenBudgetManager.prepareInputText(text, HUNDRED_CHAR_INPUT);

        assertThat(prepared).hasSizeLessThanOrEqualTo(100).endsWith("word");
    }

    @Test
    void testPrepareInputTextHardCutNeverExceedsBudget() {
        String prepared = TokenBudgetManager.prepareInputText("A".repeat(500), HUNDRED_CHAR_INPUT);

        assertThat(prepared).hasSize(HUNDRED_CHAR_INPUT.getInputChars());
    }

    @Test
    void testPrepareInputTextHardCutKeepsSurrogatePairsWhole() {
        String text = "A".repeat(99) + "\uD83D\uDE00".repeat(100);

        String prepared = TokenBudgetManager.prepareInputText(text, HUNDRED_CHAR_INPUT);

        assertThat(prepared).isEqualTo("A".repeat(99));
        assertThat(Character.isHighSurrogate(prepared.charAt(prepared.length() - 1))).isFalse();
    }

    @Test
    void testPrepareInputTextIgnoresEarlyParagraphBreak() {
        // A break this early would throw away most of the allowed text
        String text = "Tiny intro.\n\n" + "z".repeat(200);

        String prepared = TokenBudgetManager.prepareInputText(text, HUNDRED_CHAR_INPUT);

        assertThat(prepared).hasSize(100);
    }
}
