package com.storycast.processing;

import com.storycast.processing.model.ExtractedCharacterData;
import com.storycast.processing.model.PassTokenBudget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GeminiCharacterExtractionEngineTest {

    private static final PassTokenBudget BUDGET = TokenBudgetManager.BATCHED_ANALYSIS;

    @Mock
    private GeminiServiceInterface geminiService;

    private GeminiCharacterExtractionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new GeminiCharacterExtractionEngine(geminiService, new CharacterResponseParser());
    }

    @Test
    void testBuildsPromptAndParsesResponse() throws Exception {
        when(geminiService.generateContent(anyString(), eq(BUDGET.getOutputTokens()), eq("character_extraction")))
                .thenReturn("{\"Alice\":{\"D\":[\"Hello!\"],\"T\":[\"brave\"],\"V\":\"female,young,neutral\"}}");

        List<ExtractedCharacterData> characters = engine.analyze("\"Hello!\" said Alice.", 1, 5, BUDGET);

        assertThat(characters).extracting(ExtractedCharacterData::getName).containsExactly("Alice");
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(geminiService).generateContent(prompt.capture(), anyInt(), anyString());
        assertThat(prompt.getValue()).contains("PART 2 OF 5");
        assertThat(CharacterExtractionPrompt.extractText(prompt.getValue())).isEqualTo("\"Hello!\" said Alice.");
    }

    @Test
    void testOversizedBatchTextIsTruncatedToInputBudget() throws Exception {
        PassTokenBudget small = new PassTokenBudget(100, 10, 100);
        when(geminiService.generateContent(anyString(), anyInt(), anyString())).thenReturn("{}");

        engine.analyze("First sentence is short. Second sentence runs on and on past the limit.", 0, 1, small);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(geminiService).generateContent(prompt.capture(), eq(100), anyString());
        assertThat(CharacterExtractionPrompt.extractText(prompt.getValue())).isEqualTo("First sentence is short.");
    }

    @Test
    void testTimeoutIsWrapped() throws Exception {
        when(geminiService.generateContent(anyString(), anyInt(), anyString()))
                .thenThrow(new TimeoutException("deadline exceeded"));

        assertThatThrownBy(() -> engine.analyze("Some batch text here.", 3, 4, BUDGET))
                .isInstanceOf(ExtractionEngineException.class)
                .hasMessageContaining("timed out")
                .hasCauseInstanceOf(TimeoutException.class);
    }

    @Test
    void testIoFailureIsWrapped() throws Exception {
        when(geminiService.generateContent(anyString(), anyInt(), anyString()))
                .thenThrow(new IOException("503 Service Unavailable"));

        assertThatThrownBy(() -> engine.analyze("Some batch text here.", 0, 1, BUDGET))
                .isInstanceOf(ExtractionEngineException.class)
                .hasMessageContaining("503")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void testUnusableOutputIsWrapped() throws Exception {
        when(geminiService.generateContent(anyString(), anyInt(), anyString()))
                .thenReturn("Sorry, I cannot help with that.");

        assertThatThrownBy(() -> engine.analyze("Some batch text here.", 0, 1, BUDGET))
                .isInstanceOf(ExtractionEngineException.class)
                .hasMessageContaining("Unusable model output");
    }
}
