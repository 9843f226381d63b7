package com.storycast.config;

import com.storycast.processing.GeminiServiceInterface;
import com.storycast.processing.IncrementalMerger;
import com.storycast.processing.model.PassTokenBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalysisStartupConfig implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisStartupConfig.class);

    private final IncrementalMerger incrementalMerger;
    private final PassTokenBudget extractionBudget;
    private final GeminiServiceInterface geminiService;

    @Value("${vertexai.enabled:false}")
    private boolean vertexEnabled;

    public AnalysisStartupConfig(IncrementalMerger incrementalMerger, PassTokenBudget extractionBudget,
                                 GeminiServiceInterface geminiService) {
        this.incrementalMerger = incrementalMerger;
        this.extractionBudget = extractionBudget;
        this.geminiService = geminiService;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        logger.info("Name matching = {}, voice merging = {}",
                incrementalMerger.getNameMatcher(), incrementalMerger.getVoiceProfileMerger());
        logger.info("Extraction budget = {}", extractionBudget);
        logger.info("Model = {} ({})", geminiService.getModel(), vertexEnabled ? "vertex ai" : "stub");
    }
}
