package com.storycast.processing;

import com.storycast.processing.matching.FuzzyCharacterNameMatcher;
import com.storycast.processing.matching.StrictCharacterNameMatcher;
import com.storycast.processing.merging.PreferDetailedVoiceProfileMerger;
import com.storycast.processing.model.ExtractedCharacterData;
import com.storycast.processing.model.MergedCharacterData;
import com.storycast.processing.model.VoiceProfile;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IncrementalMergerTest {

    private final IncrementalMerger merger =
            new IncrementalMerger(new FuzzyCharacterNameMatcher(), new PreferDetailedVoiceProfileMerger());

    @Test
    void testSameCharacterAcrossBatchesIsMergedOnce() {
        Map<String, MergedCharacterData> accumulator = new LinkedHashMap<>();

        merger.merge(accumulator, List.of(new ExtractedCharacterData("Alice", List.of("Hello!"), List.of("brave"))));
        merger.merge(accumulator, List.of(new ExtractedCharacterData("alice", List.of("Goodbye!"), List.of("kind"))));

        assertThat(accumulator).hasSize(1);
        MergedCharacterData alice = accumulator.get("alice");
        assertThat(alice.getName()).isEqualTo("Alice");
        assertThat(alice.getDialogs()).containsExactly("Hello!", "Goodbye!");
        assertThat(alice.getTraits()).containsExactlyInAnyOrder("brave", "kind");
    }

    @Test
    void testMergeReturnsSameMapInstance() {
        Map<String, MergedCharacterData> accumulator = new LinkedHashMap<>();

        Map<String, MergedCharacterData> returned = merger.merge(accumulator,
                List.of(new ExtractedCharacterData("Bob", List.of("Hi"), List.of())));

        assertThat(returned).isSameAs(accumulator);
    }

    @Test
    void testEmptyBatchLeavesAccumulatorUnchanged() {
        Map<String, MergedCharacterData> accumulator = new LinkedHashMap<>();
        merger.merge(accumulator, List.of(new ExtractedCharacterData("Bob", List.of("Hi"), List.of("tall"))));

        merger.merge(accumulator, List.of());
        merger.merge(accumulator, null);

        assertThat(accumulator).hasSize(1);
        assertThat(accumulator.get("bob").getDialogs()).containsExactly("Hi");
        assertThat(accumulator.get("bob").getTraits()).containsExactly("tall");
    }

    @Test
    void testFuzzyVariantMergesIntoExistingEntryAndIsRemembered() {
        Map<String, MergedCharacterData> accumulator = new LinkedHashMap<>();
        merger.merge(accumulator, List.of(new ExtractedCharacterData("Harry Potter", List.of("Line 1"), List.of())));

        merger.merge(accumulator, List.of(new ExtractedCharacterData("Harry", List.of("Line 2"), List.of())));

        assertThat(accumulator).containsOnlyKeys("harry potter");
        MergedCharacterData harry = accumulator.get("harry potter");
        assertThat(harry.getDialogs()).containsExactly("Line 1", "Line 2");
        assertThat(harry.getKnownVariants()).containsExactlyInAnyOrder("harry potter", "harry");
    }

    @Test
    void testRepeatedDialogLinesAreKept() {
        Map<String, MergedCharacterData> accumulator = new LinkedHashMap<>();
        merger.merge(accumulator, List.of(new ExtractedCharacterData("Ron", List.of("Bloody hell!"), List.of())));
        merger.merge(accumulator, List.of(new ExtractedCharacterData("Ron", List.of("Bloody hell!"), List.of())));

        assertThat(accumulator.get("ron").getDialogs()).containsExactly("Bloody hell!", "Bloody hell!");
    }

    @Test
    void testTraitsAreCaseInsensitiveAndKeepFirstCasing() {
        Map<String, MergedCharacterData> accumulator = new LinkedHashMap<>();
        merger.merge(accumulator, List.of(new ExtractedCharacterData("Luna", List.of(), List.of("Dreamy", "dreamy"))));
        merger.merge(accumulator, List.of(new ExtractedCharacterData("Luna", List.of(), List.of("DREAMY", "calm"))));

        assertThat(accumulator.get("luna").getTraits()).containsExactly("Dreamy", "calm");
    }

    @Test
    void testVoiceProfilesAreMergedFieldByField() {
        Map<String, MergedCharacterData> accumulator = new LinkedHashMap<>();
        merger.merge(accumulator, List.of(new ExtractedCharacterData("Minerva", List.of(), List.of(),
                new VoiceProfile("female", "middle-aged", "neutral"))));
        merger.merge(accumulator, List.of(new ExtractedCharacterData("Minerva", List.of(), List.of(),
                new VoiceProfile("male", "elderly", "Scottish"))));

        VoiceProfile voice = accumulator.get("minerva").getVoiceProfile();
        assertThat(voice.getGender()).isEqualTo("female");
        assertThat(voice.getAge()).isEqualTo("elderly");
        assertThat(voice.getAccent()).isEqualTo("Scottish");
    }

    @Test
    void testFirstEntityInBatchClaimsTheKey() {
        Map<String, MergedCharacterData> accumulator = new LinkedHashMap<>();

        merger.merge(accumulator, List.of(
                new ExtractedCharacterData("Harry", List.of("a"), List.of()),
                new ExtractedCharacterData("Harry Potter", List.of("b"), List.of())));

        assertThat(accumulator).containsOnlyKeys("harry");
        assertThat(accumulator.get("harry").getDialogs()).containsExactly("a", "b");
    }

    @Test
    void testEntitiesWithEmptyNamesAreSkipped() {
        Map<String, MergedCharacterData> accumulator = new LinkedHashMap<>();

        merger.merge(accumulator, List.of(
                new ExtractedCharacterData("  ", List.of("orphan line"), List.of()),
                new ExtractedCharacterData("Neville", List.of("Hi"), List.of())));

        assertThat(accumulator).containsOnlyKeys("neville");
    }

    @Test
    void testAccumulatorNeverShrinksAndDialogsOnlyGrow() {
        Map<String, MergedCharacterData> accumulator = new LinkedHashMap<>();
        String[] names = {"Harry", "Hermione", "Harry Potter", "Ron", "Ginny", "Ron Weasley"};
        int previousSize = 0;
        int previousDialogs = 0;

        for (String name : names) {
            merger.merge(accumulator, List.of(new ExtractedCharacterData(name, List.of(name + " speaks"), List.of())));

            int dialogs = accumulator.values().stream().mapToInt(MergedCharacterData::getDialogCount).sum();
            assertThat(accumulator.size()).isGreaterThanOrEqualTo(previousSize);
            assertThat(dialogs).isEqualTo(previousDialogs + 1);
            previousSize = accumulator.size();
            previousDialogs = dialogs;
        }
        assertThat(accumulator).containsOnlyKeys("harry", "hermione", "ron", "ginny");
    }

    @Test
    void testStrictMatcherKeepsVariantsApart() {
        IncrementalMerger strictMerger =
                new IncrementalMerger(new StrictCharacterNameMatcher(), new PreferDetailedVoiceProfileMerger());
        Map<String, MergedCharacterData> accumulator = new LinkedHashMap<>();

        strictMerger.merge(accumulator, List.of(new ExtractedCharacterData("Harry Potter", List.of("a"), List.of())));
        strictMerger.merge(accumulator, List.of(new ExtractedCharacterData("Harry", List.of("b"), List.of())));
        strictMerger.merge(accumulator, List.of(new ExtractedCharacterData("HARRY", List.of("c"), List.of())));

        assertThat(accumulator).containsOnlyKeys("harry potter", "harry");
        assertThat(accumulator.get("harry").getDialogs()).containsExactly("b", "c");
    }

    @Test
    void testToListSortsByDialogCountThenName() {
        Map<String, MergedCharacterData> accumulator = new LinkedHashMap<>();
        merger.merge(accumulator, List.of(
                new ExtractedCharacterData("Zed", List.of("1"), List.of()),
                new ExtractedCharacterData("Anna", List.of("1"), List.of()),
                new ExtractedCharacterData("Mike", List.of("1", "2", "3"), List.of())));

        List<MergedCharacterData> characters = merger.toList(accumulator);

        assertThat(characters).extracting(MergedCharacterData::getName).containsExactly("Mike", "Anna", "Zed");
    }
}
