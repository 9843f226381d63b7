package com.storycast.processing.merging;

import com.storycast.processing.model.VoiceProfile;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VoiceProfileMergerTest {

    private final VoiceProfileMerger preferDetailed = new PreferDetailedVoiceProfileMerger();

    @Test
    void testNullSideReturnsOther() {
        VoiceProfile voice = new VoiceProfile("female", "young", "British");

        assertThat(preferDetailed.merge(null, voice)).isSameAs(voice);
        assertThat(preferDetailed.merge(voice, null)).isSameAs(voice);
        assertThat(preferDetailed.merge(null, null)).isNull();
    }

    @Test
    void testDetailedIncomingValuesFillDefaults() {
        VoiceProfile existing = new VoiceProfile("female", "middle-aged", "", 1.0f, 1.2f, 1.0f);
        VoiceProfile incoming = new VoiceProfile("male", "elderly", "Scottish", 0.8f, 1.0f, 1.0f);

        VoiceProfile merged = preferDetailed.merge(existing, incoming);

        assertThat(merged.getGender()).isEqualTo("female");
        assertThat(merged.getAge()).isEqualTo("elderly");
        assertThat(merged.getAccent()).isEqualTo("Scottish");
        assertThat(merged.getPitch()).isEqualTo(0.8f);
        assertThat(merged.getSpeed()).isEqualTo(1.2f);
        assertThat(merged.getEnergy()).isEqualTo(1.0f);
    }

    @Test
    void testDefaultIncomingNeverOverwritesDetail() {
        VoiceProfile existing = new VoiceProfile("female", "child", "Irish", 1.3f, 0.9f, 1.4f);

        VoiceProfile merged = preferDetailed.merge(existing, VoiceProfile.defaults());

        assertThat(merged).isEqualTo(existing);
    }

    @Test
    void testExistingWinsTiesBetweenDetailedValues() {
        VoiceProfile existing = new VoiceProfile("female", "young", "American");
        VoiceProfile incoming = new VoiceProfile("female", "elderly", "British");

        VoiceProfile merged = preferDetailed.merge(existing, incoming);

        assertThat(merged.getAge()).isEqualTo("young");
        assertThat(merged.getAccent()).isEqualTo("American");
    }

    @Test
    void testPreferNewAndPreferExisting() {
        VoiceProfile first = new VoiceProfile("female", "young", "American");
        VoiceProfile second = new VoiceProfile("male", "elderly", "British");

        assertThat(new PreferNewVoiceProfileMerger().merge(first, second)).isSameAs(second);
        assertThat(new PreferNewVoiceProfileMerger().merge(first, null)).isSameAs(first);
        assertThat(new PreferExistingVoiceProfileMerger().merge(first, second)).isSameAs(first);
        assertThat(new PreferExistingVoiceProfileMerger().merge(null, second)).isSameAs(second);
    }
}
