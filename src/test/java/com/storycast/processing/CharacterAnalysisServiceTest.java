package com.storycast.processing;

import com.storycast.processing.model.AnalysisCheckpoint;
import com.storycast.processing.model.AnalysisRequest;
import com.storycast.processing.model.AnalysisResult;
import com.storycast.processing.model.MergedCharacterData;
import com.storycast.processing.model.SessionState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full pipeline through the Spring context, with Gemini in stub mode.
 */
@SpringBootTest
class CharacterAnalysisServiceTest {

    private static final List<String> PAGES = List.of(
            "\"We must hurry,\" said Harry. The rain kept falling on the old castle walls.\n\n"
                    + "Hermione replied, \"Not without the map.\"\n\n3",
            "\"I have it right here,\" said Harry Potter. Nobody else moved in the dark hall.");

    @Autowired
    private CharacterAnalysisService analysisService;

    @Autowired
    private CheckpointCodec checkpointCodec;

    @Test
    void testAnalyzesDocumentEndToEnd() {
        AnalysisResult result = analysisService.analyze(AnalysisRequest.of("doc-1", PAGES));

        assertThat(result.getState()).isEqualTo(SessionState.COMPLETED);
        assertThat(result.getTotalBatches()).isEqualTo(1);
        assertThat(result.getPagesProcessed()).isEqualTo(2);
        assertThat(result.getCharacters()).extracting(MergedCharacterData::getName)
                .containsExactly("Harry", "Hermione");
        MergedCharacterData harry = result.getCharacters().get(0);
        assertThat(harry.getDialogs()).containsExactly("We must hurry", "I have it right here");
        assertThat(harry.getKnownVariants()).contains("harry potter");
        assertThat(result.getDialogCount()).isEqualTo(3);
    }

    @Test
    void testSessionsDoNotShareState() {
        analysisService.analyze(AnalysisRequest.of("doc-1", PAGES));
        AnalysisResult second = analysisService.analyze(AnalysisRequest.of("doc-2", PAGES));

        assertThat(second.getCharacters().get(0).getDialogs()).hasSize(2);
    }

    @Test
    void testCheckpointFromListenerSurvivesSerialization() throws Exception {
        List<AnalysisCheckpoint> checkpoints = new ArrayList<>();
        analysisService.analyze(AnalysisRequest.of("doc-1", PAGES), new AnalysisProgressListener() {
            @Override
            public void onBatchComplete(int batchIndex, int totalBatches, List<MergedCharacterData> characters) {
            }

            @Override
            public void onSessionComplete(List<MergedCharacterData> characters, int failedBatchCount) {
            }

            @Override
            public void onCheckpoint(AnalysisCheckpoint checkpoint) {
                checkpoints.add(checkpoint);
            }
        });

        assertThat(checkpoints).hasSize(1);
        AnalysisCheckpoint decoded = checkpointCodec.decode(checkpointCodec.encode(checkpoints.get(0)));
        assertThat(decoded.isComplete()).isTrue();
        assertThat(decoded.getAccumulatedCharacters()).hasSize(2);
    }

    @Test
    void testEstimateBatchCount() {
        assertThat(analysisService.estimateBatchCount(AnalysisRequest.of("doc-1", PAGES))).isEqualTo(1);
        assertThat(analysisService.estimateBatchCount(AnalysisRequest.of("doc-1", List.of()))).isZero();
    }
}
