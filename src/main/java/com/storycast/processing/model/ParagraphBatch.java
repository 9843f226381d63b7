package com.storycast.processing.model;

/**
 * A contiguous run of paragraphs packed to fit one model call.
 * Paragraph indices are global (relative to the full paragraph list) and inclusive.
 */
public class ParagraphBatch {
    private final int batchIndex;
    private final int startParagraphIndex;
    private final int endParagraphIndex;
    private final String text;
    private final int paragraphCount;
    private final int estimatedTokens;

    public ParagraphBatch(int batchIndex, int startParagraphIndex, int endParagraphIndex,
                          String text, int paragraphCount, int estimatedTokens) {
        if (endParagraphIndex - startParagraphIndex + 1 != paragraphCount) {
            throw new IllegalArgumentException(String.format(
                    "Paragraph range %d-%d does not hold %d paragraphs",
                    startParagraphIndex, endParagraphIndex, paragraphCount));
        }
        this.batchIndex = batchIndex;
        this.startParagraphIndex = startParagraphIndex;
        this.endParagraphIndex = endParagraphIndex;
        this.text = text;
        this.paragraphCount = paragraphCount;
        this.estimatedTokens = estimatedTokens;
    }

    public int getBatchIndex() {
        return batchIndex;
    }

    public int getStartParagraphIndex() {
        return startParagraphIndex;
    }

    public int getEndParagraphIndex() {
        return endParagraphIndex;
    }

    public String getText() {
        return text;
    }

    public int getParagraphCount() {
        return paragraphCount;
    }

    public int getEstimatedTokens() {
        return estimatedTokens;
    }

    /**
     * Returns a copy of this batch shifted by {@code offset} paragraphs.
     */
    public ParagraphBatch shiftedBy(int offset) {
        return new ParagraphBatch(batchIndex, startParagraphIndex + offset, endParagraphIndex + offset,
                text, paragraphCount, estimatedTokens);
    }

    @Override
    public String toString() {
        return "ParagraphBatch{index=" + batchIndex + ", paragraphs=" + startParagraphIndex + "-"
                + endParagraphIndex + ", chars=" + text.length() + ", tokens~" + estimatedTokens + "}";
    }
}
