package com.storycast.processing;

import com.storycast.processing.model.ExtractedCharacterData;
import com.storycast.processing.model.PassTokenBudget;

import java.util.List;

/**
 * Extracts the speaking characters of one batch of text.
 *
 * <p>Implementations hold a single generation context and are not reentrant: the orchestrator
 * calls them strictly one batch at a time.</p>
 */
public interface ExtractionEngine {

    /**
     * @param batchText    paragraphs of the batch joined by blank lines
     * @param batchIndex   0-based index of the batch
     * @param totalBatches number of batches in the session
     * @param budget       token budget for the call
     * @return characters found in the batch, possibly empty
     * @throws ExtractionEngineException if the call failed or its output could not be used
     */
    List<ExtractedCharacterData> analyze(String batchText, int batchIndex, int totalBatches,
                                         PassTokenBudget budget) throws ExtractionEngineException;
}
