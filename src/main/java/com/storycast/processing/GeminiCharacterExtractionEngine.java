package com.storycast.processing;

import com.storycast.processing.model.ExtractedCharacterData;
import com.storycast.processing.model.PassTokenBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Extraction engine backed by Gemini: one prompt per batch, output parsed into characters.
 */
@Service
public class GeminiCharacterExtractionEngine implements ExtractionEngine {

    private static final Logger logger = LoggerFactory.getLogger(GeminiCharacterExtractionEngine.class);
    static final String TASK_TYPE = "character_extraction";

    private final GeminiServiceInterface geminiService;
    private final CharacterResponseParser responseParser;

    public GeminiCharacterExtractionEngine(GeminiServiceInterface geminiService,
                                           CharacterResponseParser responseParser) {
        this.geminiService = geminiService;
        this.responseParser = responseParser;
    }

    @Override
    public List<ExtractedCharacterData> analyze(String batchText, int batchIndex, int totalBatches,
                                                PassTokenBudget budget) throws ExtractionEngineException {
        String inputText = TokenBudgetManager.prepareInputText(batchText, budget);
        if (inputText.length() < batchText.length()) {
            logger.warn("Batch {} truncated from {} to {} chars to fit the input budget",
                    batchIndex, batchText.length(), inputText.length());
        }

        String prompt = CharacterExtractionPrompt.build(inputText, batchIndex, totalBatches);
        int promptOverhead = TokenBudgetManager.estimateTokens(prompt) - TokenBudgetManager.estimateTokens(inputText);
        if (promptOverhead > budget.getPromptTokens()) {
            logger.debug("Prompt template uses ~{} tokens, budget allows {}", promptOverhead, budget.getPromptTokens());
        }

        String response;
        try {
            response = geminiService.generateContent(prompt, budget.getOutputTokens(), TASK_TYPE);
        } catch (TimeoutException e) {
            throw new ExtractionEngineException("Model call timed out for batch " + batchIndex, e);
        } catch (IOException e) {
            throw new ExtractionEngineException("Model call failed for batch " + batchIndex + ": " + e.getMessage(), e);
        }

        try {
            List<ExtractedCharacterData> characters = responseParser.parse(response);
            logger.info("Batch {}/{}: model reported {} characters", batchIndex + 1, totalBatches, characters.size());
            return characters;
        } catch (IOException e) {
            throw new ExtractionEngineException("Unusable model output for batch " + batchIndex + ": " + e.getMessage(), e);
        }
    }
}
