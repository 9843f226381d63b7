package com.storycast.processing;

import com.storycast.processing.model.ParagraphBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Packs paragraphs into contiguous batches that each fit an input token budget.
 * Paragraphs are never split: one that exceeds the budget on its own becomes a batch of one.
 */
@Service
public class ParagraphBatcher {

    private static final Logger logger = LoggerFactory.getLogger(ParagraphBatcher.class);

    static final String PARAGRAPH_SEPARATOR = "\n\n";

    /**
     * Greedily packs consecutive paragraphs into batches.
     *
     * @param paragraphs     normalized paragraphs
     * @param maxInputTokens token limit for the text of one batch
     * @return batches covering every paragraph exactly once, in order
     */
    public List<ParagraphBatch> createBatches(List<String> paragraphs, int maxInputTokens) {
        if (paragraphs == null || paragraphs.isEmpty()) {
            logger.debug("No paragraphs to batch");
            return List.of();
        }
        if (maxInputTokens <= 0) {
            throw new IllegalArgumentException("maxInputTokens must be positive: " + maxInputTokens);
        }

        List<ParagraphBatch> batches = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int currentStart = 0;
        int currentCount = 0;

        for (int i = 0; i < paragraphs.size(); i++) {
            String paragraph = paragraphs.get(i);
            if (currentCount > 0) {
                int candidateLength = current.length() + PARAGRAPH_SEPARATOR.length() + paragraph.length();
                if (tokensFor(candidateLength) > maxInputTokens) {
                    batches.add(toBatch(batches.size(), currentStart, current.toString(), currentCount));
                    current.setLength(0);
                    currentStart = i;
                    currentCount = 0;
                }
            }
            if (currentCount > 0) {
                current.append(PARAGRAPH_SEPARATOR);
            }
            current.append(paragraph);
            currentCount++;
        }
        batches.add(toBatch(batches.size(), currentStart, current.toString(), currentCount));

        logger.info("Created {} batches from {} paragraphs (maxTokens={})",
                batches.size(), paragraphs.size(), maxInputTokens);
        if (logger.isDebugEnabled()) {
            for (ParagraphBatch batch : batches) {
                logger.debug("Batch {}: paragraphs {}-{}, {} chars (~{} tokens, {}% fill)",
                        batch.getBatchIndex(), batch.getStartParagraphIndex(), batch.getEndParagraphIndex(),
                        batch.getText().length(), batch.getEstimatedTokens(),
                        batch.getEstimatedTokens() * 100 / maxInputTokens);
            }
        }
        return batches;
    }

    /**
     * Packs the paragraphs from {@code startIndex} onwards. Returned paragraph indices are global;
     * batch indices restart at 0.
     *
     * @return batches for the remaining paragraphs, empty when {@code startIndex} is out of range
     */
    public List<ParagraphBatch> createBatchesFromIndex(List<String> paragraphs, int maxInputTokens, int startIndex) {
        if (paragraphs == null || startIndex < 0 || startIndex >= paragraphs.size()) {
            logger.debug("Start index {} is outside the paragraph list, nothing to batch", startIndex);
            return List.of();
        }
        return createBatches(paragraphs.subList(startIndex, paragraphs.size()), maxInputTokens).stream()
                .map(batch -> batch.shiftedBy(startIndex))
                .collect(Collectors.toList());
    }

    /**
     * Cheap batch count used for progress reporting before batching: total estimated tokens
     * divided by the budget, rounded up.
     *
     * @return 0 for empty input, at least 1 otherwise
     */
    public int estimateBatchCount(List<String> paragraphs, int maxInputTokens) {
        if (paragraphs == null || paragraphs.isEmpty()) {
            return 0;
        }
        if (maxInputTokens <= 0) {
            throw new IllegalArgumentException("maxInputTokens must be positive: " + maxInputTokens);
        }
        long totalTokens = 0;
        for (String paragraph : paragraphs) {
            totalTokens += TokenBudgetManager.estimateTokens(paragraph);
        }
        return (int) Math.max(1, (totalTokens + maxInputTokens - 1) / maxInputTokens);
    }

    private static ParagraphBatch toBatch(int batchIndex, int start, String text, int count) {
        return new ParagraphBatch(batchIndex, start, start + count - 1, text, count,
                TokenBudgetManager.estimateTokens(text));
    }

    private static int tokensFor(int chars) {
        return (chars + TokenBudgetManager.CHARS_PER_TOKEN - 1) / TokenBudgetManager.CHARS_PER_TOKEN;
    }
}
