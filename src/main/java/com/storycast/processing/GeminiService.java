package com.storycast.processing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.genai.Client;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.HttpOptions;
import com.storycast.observability.AnalysisMetricsServiceInterface;
import com.storycast.observability.TracingServiceInterface;
import com.storycast.processing.model.VoiceProfile;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Service for calling Google Vertex AI Gemini.
 * Supports local stub mode when vertexai.enabled=false.
 * When enabled=true, uses real Vertex AI Gemini with ADC (Application Default Credentials).
 */
@Service
public class GeminiService implements GeminiServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(GeminiService.class);
    private static final String DEFAULT_MODEL = "gemini-2.0-flash";

    // Stub mode: "...," said Name / Name said, "..."
    private static final String SPEECH_VERBS = "said|asked|replied|answered|whispered|shouted|cried|muttered|called|exclaimed";
    private static final Pattern QUOTE_THEN_SPEAKER = Pattern.compile(
            "[\"“]([^\"”]{2,})[\"”]\\s*,?\\s*(?:" + SPEECH_VERBS + ")\\s+(\\p{Lu}\\p{L}+(?:\\s+\\p{Lu}\\p{L}+)?)");
    private static final Pattern SPEAKER_THEN_QUOTE = Pattern.compile(
            "(\\p{Lu}\\p{L}+(?:\\s+\\p{Lu}\\p{L}+)?)\\s+(?:" + SPEECH_VERBS + ")\\s*,?\\s*[\"“]([^\"”]{2,})[\"”]");
    private static final Set<String> PRONOUNS = Set.of("he", "she", "they", "i", "we", "you", "it", "then", "and");

    private final boolean enabled;
    private final String projectId;
    private final String location;
    private final String model;
    private final int timeoutSeconds;
    private final float temperature;
    private final ObjectMapper objectMapper;
    private final AnalysisMetricsServiceInterface metricsService;
    private final TracingServiceInterface tracingService;
    private Client client;

    public GeminiService(
            @Value("${vertexai.enabled:false}") boolean enabled,
            @Value("${vertexai.project-id:${GOOGLE_CLOUD_PROJECT:local-project}}") String projectId,
            @Value("${vertexai.location:us-central1}") String location,
            @Value("${vertexai.model:gemini-2.0-flash}") String model,
            @Value("${vertexai.timeout-seconds:60}") int timeoutSeconds,
            @Value("${vertexai.temperature:0.2}") float temperature,
            @Autowired(required = false) AnalysisMetricsServiceInterface metricsService,
            @Autowired(required = false) TracingServiceInterface tracingService) {
        this.enabled = enabled;
        this.projectId = projectId;
        this.location = location;
        this.model = model != null && !model.isEmpty() ? model : DEFAULT_MODEL;
        this.timeoutSeconds = timeoutSeconds;
        this.temperature = temperature;
        this.objectMapper = new ObjectMapper();
        this.metricsService = metricsService;
        this.tracingService = tracingService;

        logger.info("GeminiService initialized: enabled={}, projectId={}, location={}, model={}, timeout={}s",
                this.enabled, this.projectId, this.location, this.model, this.timeoutSeconds);

        if (this.enabled && !"local-project".equals(projectId)) {
            this.client = initializeClient();
        } else {
            logger.info("Vertex AI disabled or using local project, will use stub mode");
        }
    }

    private Client initializeClient() {
        try {
            Client clientInstance = Client.builder()
                    .project(this.projectId)
                    .location(this.location)
                    .vertexAI(true)
                    .httpOptions(HttpOptions.builder()
                            .apiVersion("v1")
                            .timeout(this.timeoutSeconds * 1000)
                            .build())
                    .build();
            logger.info("Google Gen AI SDK client initialized with Vertex AI enabled");
            return clientInstance;
        } catch (Exception e) {
            logger.error("Failed to initialize Google Gen AI SDK client: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to initialize Google Gen AI SDK client", e);
        }
    }

    @Override
    public String getModel() {
        return model;
    }

    /**
     * Calls Gemini with the given prompt and output limit.
     * Records latency and estimated token metrics, and wraps the call in an "llm.call" span.
     *
     * @param prompt          The prompt to send to Gemini
     * @param maxOutputTokens Upper bound on generated tokens
     * @param taskType        Task type for metrics (e.g. "character_extraction")
     * @return Generated text response
     * @throws IOException      if the API call fails or returns nothing
     * @throws TimeoutException if the request exceeds vertexai.timeout-seconds
     */
    @Override
    public String generateContent(String prompt, int maxOutputTokens, String taskType)
            throws IOException, TimeoutException {
        logger.debug("Calling Gemini: enabled={}, model={}, promptLength={}, maxOutputTokens={}, taskType={}",
                enabled, model, prompt.length(), maxOutputTokens, taskType);

        long startTime = System.currentTimeMillis();

        Span llmSpan = null;
        if (tracingService != null) {
            llmSpan = tracingService.spanBuilder("llm.call")
                    .setAttribute("stage", "llm")
                    .setAttribute("provider", "gemini")
                    .setAttribute("model", model)
                    .setAttribute("task_type", taskType)
                    .setAttribute("prompt_length", prompt.length())
                    .setAttribute("max_output_tokens", maxOutputTokens)
                    .startSpan();
        }

        try (Scope scope = llmSpan != null ? llmSpan.makeCurrent() : null) {
            if (!enabled) {
                logger.debug("Using stub mode (vertexai.enabled=false)");
                String stubResponse = generateStubResponse(prompt);
                recordSuccess(llmSpan, prompt, stubResponse, startTime, taskType, true);
                return stubResponse;
            }

            if (client == null) {
                throw new IOException("Vertex AI is enabled but client initialization failed");
            }

            try {
                GenerateContentConfig config = GenerateContentConfig.builder()
                        .maxOutputTokens(maxOutputTokens)
                        .temperature(temperature)
                        .build();
                GenerateContentResponse response = client.models.generateContent(model, prompt, config);
                String responseText = response.text();

                if (responseText == null || responseText.isBlank()) {
                    throw new IOException("Gemini API returned empty or null response");
                }

                recordSuccess(llmSpan, prompt, responseText, startTime, taskType, false);
                logger.debug("Gemini call successful, responseLength={}", responseText.length());
                return responseText;

            } catch (IOException e) {
                recordFailure(llmSpan, e, startTime, taskType);
                throw e;
            } catch (Exception e) {
                recordFailure(llmSpan, e, startTime, taskType);
                if (isTimeout(e)) {
                    TimeoutException timeout = new TimeoutException(
                            "Gemini call timed out after " + timeoutSeconds + "s");
                    timeout.initCause(e);
                    throw timeout;
                }
                throw new IOException("Gemini API call failed: " + e.getMessage(), e);
            }
        } finally {
            if (llmSpan != null) {
                llmSpan.end();
            }
        }
    }

    private void recordSuccess(Span llmSpan, String prompt, String responseText, long startTime,
                               String taskType, boolean stubMode) {
        long durationMs = System.currentTimeMillis() - startTime;
        int estimatedInputTokens = TokenBudgetManager.estimateTokens(prompt);
        int estimatedOutputTokens = TokenBudgetManager.estimateTokens(responseText);

        if (metricsService != null) {
            metricsService.recordLlmLatency(durationMs, model, taskType);
            metricsService.recordLlmTokens(estimatedInputTokens, estimatedOutputTokens, model, taskType);
        }
        if (llmSpan != null) {
            llmSpan.setStatus(StatusCode.OK);
            llmSpan.setAttribute("stub_mode", stubMode);
            llmSpan.setAttribute("duration_ms", durationMs);
            llmSpan.setAttribute("tokens.input", estimatedInputTokens);
            llmSpan.setAttribute("tokens.output", estimatedOutputTokens);
            llmSpan.setAttribute("response_length", responseText.length());
        }
    }

    private void recordFailure(Span llmSpan, Exception e, long startTime, String taskType) {
        logger.error("Gemini API call failed: {}", e.getMessage(), e);
        if (metricsService != null) {
            metricsService.recordLlmLatency(System.currentTimeMillis() - startTime, model, taskType);
        }
        if (llmSpan != null) {
            llmSpan.setStatus(StatusCode.ERROR);
            llmSpan.setAttribute("error", true);
            llmSpan.setAttribute("error.message", String.valueOf(e.getMessage()));
            llmSpan.recordException(e);
        }
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedIOException || cause instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    /**
     * Deterministic stand-in for the model, used for local runs and tests when vertexai.enabled=false.
     * Attributes quoted dialog to the name next to a speech verb and answers in the extraction format.
     */
    String generateStubResponse(String prompt) {
        logger.debug("Generating stub response for prompt (stub mode)");
        String text = CharacterExtractionPrompt.extractText(prompt);

        Map<String, List<String>> dialogsBySpeaker = new LinkedHashMap<>();
        collectDialogs(QUOTE_THEN_SPEAKER.matcher(text), 2, 1, dialogsBySpeaker);
        collectDialogs(SPEAKER_THEN_QUOTE.matcher(text), 1, 2, dialogsBySpeaker);

        ObjectNode root = objectMapper.createObjectNode();
        dialogsBySpeaker.forEach((speaker, dialogs) -> {
            ObjectNode entry = root.putObject(speaker);
            dialogs.forEach(entry.putArray("D")::add);
            entry.putArray("T");
            entry.put("V", VoiceProfile.DEFAULT_GENDER + "," + VoiceProfile.DEFAULT_AGE + "," + VoiceProfile.DEFAULT_ACCENT);
        });
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stub response", e);
        }
    }

    private static void collectDialogs(Matcher matcher, int speakerGroup, int dialogGroup,
                                       Map<String, List<String>> dialogsBySpeaker) {
        while (matcher.find()) {
            String speaker = matcher.group(speakerGroup).trim();
            if (PRONOUNS.contains(speaker.split("\\s+")[0].toLowerCase(Locale.ROOT))) {
                continue;
            }
            String dialog = matcher.group(dialogGroup).trim().replaceAll("[,]$", "");
            dialogsBySpeaker.computeIfAbsent(speaker, key -> new ArrayList<>()).add(dialog);
        }
    }
}
