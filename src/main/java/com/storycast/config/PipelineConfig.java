package com.storycast.config;

import com.storycast.processing.IncrementalMerger;
import com.storycast.processing.matching.CharacterNameMatcher;
import com.storycast.processing.matching.FuzzyCharacterNameMatcher;
import com.storycast.processing.matching.StrictCharacterNameMatcher;
import com.storycast.processing.merging.PreferDetailedVoiceProfileMerger;
import com.storycast.processing.merging.PreferExistingVoiceProfileMerger;
import com.storycast.processing.merging.PreferNewVoiceProfileMerger;
import com.storycast.processing.merging.VoiceProfileMerger;
import com.storycast.processing.model.PassTokenBudget;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Wires the matching and merging strategies and the extraction token budget from configuration.
 * An unknown strategy name or a budget over the total fails startup.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public CharacterNameMatcher characterNameMatcher(
            @Value("${storycast.matching.strategy:fuzzy}") String strategy) {
        switch (strategy.trim().toLowerCase(Locale.ROOT)) {
            case "fuzzy":
                return new FuzzyCharacterNameMatcher();
            case "strict":
                return new StrictCharacterNameMatcher();
            default:
                throw new IllegalArgumentException("Unknown storycast.matching.strategy: " + strategy);
        }
    }

    @Bean
    public VoiceProfileMerger voiceProfileMerger(
            @Value("${storycast.merging.voice-strategy:prefer-detailed}") String strategy) {
        switch (strategy.trim().toLowerCase(Locale.ROOT)) {
            case "prefer-detailed":
                return new PreferDetailedVoiceProfileMerger();
            case "prefer-new":
                return new PreferNewVoiceProfileMerger();
            case "prefer-existing":
                return new PreferExistingVoiceProfileMerger();
            default:
                throw new IllegalArgumentException("Unknown storycast.merging.voice-strategy: " + strategy);
        }
    }

    @Bean
    public IncrementalMerger incrementalMerger(CharacterNameMatcher characterNameMatcher,
                                               VoiceProfileMerger voiceProfileMerger) {
        return new IncrementalMerger(characterNameMatcher, voiceProfileMerger);
    }

    /**
     * Budget for the batched extraction call. Defaults match the single-call analysis budget.
     */
    @Bean
    public PassTokenBudget extractionBudget(
            @Value("${storycast.extraction.prompt-tokens:300}") int promptTokens,
            @Value("${storycast.extraction.input-tokens:2700}") int inputTokens,
            @Value("${storycast.extraction.output-tokens:1000}") int outputTokens) {
        return new PassTokenBudget(promptTokens, inputTokens, outputTokens);
    }
}
