package com.storycast.processing;

import com.storycast.processing.model.ParagraphLayout;
import com.storycast.processing.model.ParagraphLayout.PageRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans raw page text and splits it into paragraphs, the atomic unit of batching.
 */
@Service
public class TextNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(TextNormalizer.class);

    /** Fragments at or below this length (after trimming) are dropped as stray headers/footers. */
    static final int MIN_PARAGRAPH_LENGTH = 10;

    // "12", "Page 12", "- 12 -", "[12]", "(12)", "12."
    private static final Pattern PAGE_NUMBER_LINE = Pattern.compile(
            "(?i)[\\p{Punct} ]*(?:page )?[\\p{Punct} ]*\\d+[\\p{Punct} ]*");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[\\t\\x0B\\f\\u00A0 ]+");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern ANY_WHITESPACE = Pattern.compile("\\s+");

    /**
     * Cleans a single page: removes page-number lines, collapses whitespace and trims lines.
     * Applying it twice gives the same result as applying it once.
     *
     * @param raw raw page text, may be null
     * @return cleaned text, never null
     */
    public String cleanPage(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String cleaned = raw.replace("\r\n", "\n").replace('\r', '\n');
        cleaned = HORIZONTAL_WHITESPACE.matcher(cleaned).replaceAll(" ");

        List<String> lines = new ArrayList<>();
        for (String line : cleaned.split("\n", -1)) {
            String trimmed = line.trim();
            lines.add(PAGE_NUMBER_LINE.matcher(trimmed).matches() ? "" : trimmed);
        }

        cleaned = EXCESS_NEWLINES.matcher(String.join("\n", lines).trim()).replaceAll("\n\n");
        return cleaned;
    }

    /**
     * Cleans every page and splits the concatenated text into paragraphs.
     *
     * @param pages raw page texts in reading order
     * @return paragraphs longer than {@value #MIN_PARAGRAPH_LENGTH} characters, in order
     */
    public List<String> splitIntoParagraphs(List<String> pages) {
        return splitWithPageMapping(pages).getParagraphs();
    }

    /**
     * Same splitting as {@link #splitIntoParagraphs(List)} while recording, for each page,
     * the index of the first paragraph it contributed.
     *
     * @param pages raw page texts in reading order
     * @return paragraphs plus page boundaries (page count + 1 entries)
     */
    public ParagraphLayout splitWithPageMapping(List<String> pages) {
        List<String> paragraphs = new ArrayList<>();
        if (pages == null || pages.isEmpty()) {
            return new ParagraphLayout(paragraphs, new int[]{0});
        }

        int[] boundaries = new int[pages.size() + 1];
        for (int pageIndex = 0; pageIndex < pages.size(); pageIndex++) {
            boundaries[pageIndex] = paragraphs.size();
            appendParagraphs(cleanPage(pages.get(pageIndex)), paragraphs);
        }
        boundaries[pages.size()] = paragraphs.size();

        logger.debug("Split {} pages into {} paragraphs", pages.size(), paragraphs.size());
        return new ParagraphLayout(paragraphs, boundaries);
    }

    /**
     * Finds the pages that a paragraph range spans.
     *
     * @param startParagraph first paragraph index (inclusive)
     * @param endParagraph   last paragraph index (inclusive)
     * @param pageBoundaries boundaries produced by {@link #splitWithPageMapping(List)}
     * @return inclusive range of page indices overlapping the paragraph range
     */
    public PageRange findPagesForParagraphRange(int startParagraph, int endParagraph, int[] pageBoundaries) {
        if (pageBoundaries == null || pageBoundaries.length < 2) {
            throw new IllegalArgumentException("Page boundaries must cover at least one page");
        }
        int totalParagraphs = pageBoundaries[pageBoundaries.length - 1];
        if (startParagraph < 0 || endParagraph < startParagraph || endParagraph >= totalParagraphs) {
            throw new IllegalArgumentException(String.format(
                    "Paragraph range %d-%d is outside 0-%d", startParagraph, endParagraph, totalParagraphs - 1));
        }
        return new PageRange(pageOf(startParagraph, pageBoundaries), pageOf(endParagraph, pageBoundaries));
    }

    private void appendParagraphs(String cleanedPage, List<String> paragraphs) {
        if (cleanedPage.isEmpty()) {
            return;
        }
        for (String fragment : PARAGRAPH_BREAK.split(cleanedPage)) {
            String paragraph = ANY_WHITESPACE.matcher(fragment.trim()).replaceAll(" ");
            if (paragraph.length() > MIN_PARAGRAPH_LENGTH) {
                paragraphs.add(paragraph);
            }
        }
    }

    // Largest page whose first paragraph is at or before the given paragraph.
    private int pageOf(int paragraph, int[] pageBoundaries) {
        int low = 0;
        int high = pageBoundaries.length - 2;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (pageBoundaries[mid] <= paragraph) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }
}
