package com.storycast.processing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storycast.processing.model.AnalysisCheckpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * JSON form of {@link AnalysisCheckpoint}, for hosts that persist checkpoints between runs.
 */
@Component
public class CheckpointCodec {

    private static final Logger logger = LoggerFactory.getLogger(CheckpointCodec.class);

    private final ObjectMapper objectMapper;

    public CheckpointCodec() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public String encode(AnalysisCheckpoint checkpoint) {
        try {
            return objectMapper.writeValueAsString(checkpoint);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint for session "
                    + checkpoint.getSessionId(), e);
        }
    }

    /**
     * @throws IOException if the JSON is not a checkpoint
     */
    public AnalysisCheckpoint decode(String json) throws IOException {
        try {
            return objectMapper.readValue(json, AnalysisCheckpoint.class);
        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable checkpoint: {}", e.getOriginalMessage());
            throw new IOException("Failed to parse checkpoint: " + e.getOriginalMessage(), e);
        }
    }
}
