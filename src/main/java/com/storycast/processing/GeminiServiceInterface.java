package com.storycast.processing;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Interface for Gemini service to support both real and stub implementations.
 */
public interface GeminiServiceInterface {
    String generateContent(String prompt, int maxOutputTokens, String taskType) throws IOException, TimeoutException;
    String getModel();
}
