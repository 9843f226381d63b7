package com.storycast.processing;

import com.storycast.processing.model.PassTokenBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token accounting for model calls, using a fixed characters-per-token ratio.
 *
 * <p>Each pass against the model gets its own {@link PassTokenBudget}. The predefined budgets are
 * validated when this class is loaded, so an inconsistent constant fails immediately.</p>
 */
public final class TokenBudgetManager {

    private static final Logger logger = LoggerFactory.getLogger(TokenBudgetManager.class);

    public static final int TOTAL_TOKEN_BUDGET = PassTokenBudget.TOTAL_TOKEN_BUDGET;
    public static final int CHARS_PER_TOKEN = PassTokenBudget.CHARS_PER_TOKEN;

    /** Character names only: short output, most of the window for text. */
    public static final PassTokenBudget CHARACTER_EXTRACTION = new PassTokenBudget(200, 3300, 100);

    /** Dialog lines need room on the output side. */
    public static final PassTokenBudget DIALOG_EXTRACTION = new PassTokenBudget(300, 1500, 2200);

    public static final PassTokenBudget VOICE_PROFILE = new PassTokenBudget(400, 2100, 1500);

    /** Single-call extraction of names, dialogs, traits and voice for one batch. */
    public static final PassTokenBudget BATCHED_ANALYSIS = new PassTokenBudget(300, 2700, 1000);

    // A boundary cut is accepted only when it keeps at least this share of the allowed characters.
    private static final double MIN_CUT_RATIO = 0.5;

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?][\"'”’)]*(?=\\s|$)");

    private TokenBudgetManager() {
    }

    /**
     * @return ceil(length / {@value #CHARS_PER_TOKEN}), 0 for null or empty text
     */
    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public static boolean fitsWithinTokens(String text, int tokenLimit) {
        return estimateTokens(text) <= tokenLimit;
    }

    /**
     * Truncates text to the input side of a budget.
     *
     * <p>Text that already fits is returned unchanged. Otherwise the cut is made at the last
     * paragraph break within the limit, then the last sentence end, then the last space, and
     * finally at the limit itself. The result never exceeds {@link PassTokenBudget#getInputChars()}.</p>
     */
    public static String prepareInputText(String text, PassTokenBudget budget) {
        if (text == null) {
            return "";
        }
        int maxChars = budget.getInputChars();
        if (estimateTokens(text) * CHARS_PER_TOKEN <= maxChars) {
            return text;
        }

        int windowEnd = Math.min(maxChars, text.length());
        if (windowEnd > 0 && Character.isHighSurrogate(text.charAt(windowEnd - 1))) {
            windowEnd--;
        }
        String window = text.substring(0, windowEnd);
        int minCut = (int) (maxChars * MIN_CUT_RATIO);

        int paragraphCut = lastParagraphBreak(window);
        if (paragraphCut >= minCut && paragraphCut > 0) {
            logger.debug("Truncated input at paragraph boundary: {}/{} chars", paragraphCut, maxChars);
            return window.substring(0, paragraphCut).stripTrailing();
        }

        int sentenceCut = lastSentenceEnd(window);
        if (sentenceCut >= minCut && sentenceCut > 0) {
            logger.debug("Truncated input at sentence boundary: {}/{} chars", sentenceCut, maxChars);
            return window.substring(0, sentenceCut);
        }

        int spaceCut = window.lastIndexOf(' ');
        if (spaceCut >= minCut && spaceCut > 0) {
            return window.substring(0, spaceCut);
        }

        logger.debug("Hard-truncated input at {} chars", window.length());
        return window;
    }

    private static int lastParagraphBreak(String window) {
        Matcher matcher = PARAGRAPH_BREAK.matcher(window);
        int cut = -1;
        while (matcher.find()) {
            cut = matcher.start();
        }
        return cut;
    }

    // Index just past the punctuation (and any closing quote) of the last complete sentence.
    private static int lastSentenceEnd(String window) {
        Matcher matcher = SENTENCE_END.matcher(window);
        int cut = -1;
        while (matcher.find()) {
            cut = matcher.end();
        }
        return cut;
    }
}
