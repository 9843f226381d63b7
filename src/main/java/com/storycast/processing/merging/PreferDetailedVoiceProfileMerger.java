package com.storycast.processing.merging;

import com.storycast.processing.model.VoiceProfile;

/**
 * Field-by-field merge where a specific value beats a default one.
 *
 * <p>The existing value is kept unless it is blank or default and the incoming value is not.
 * When both sides are equally specific the existing value wins, so a value established by an
 * earlier batch is never replaced by a default.</p>
 */
public class PreferDetailedVoiceProfileMerger implements VoiceProfileMerger {

    @Override
    public VoiceProfile merge(VoiceProfile existing, VoiceProfile incoming) {
        if (existing == null) {
            return incoming;
        }
        if (incoming == null) {
            return existing;
        }
        return new VoiceProfile(
                existing.isGenderDefault() && !incoming.isGenderDefault() ? incoming.getGender() : existing.getGender(),
                existing.isAgeDefault() && !incoming.isAgeDefault() ? incoming.getAge() : existing.getAge(),
                existing.isAccentDefault() && !incoming.isAccentDefault() ? incoming.getAccent() : existing.getAccent(),
                existing.isPitchDefault() && !incoming.isPitchDefault() ? incoming.getPitch() : existing.getPitch(),
                existing.isSpeedDefault() && !incoming.isSpeedDefault() ? incoming.getSpeed() : existing.getSpeed(),
                existing.isEnergyDefault() && !incoming.isEnergyDefault() ? incoming.getEnergy() : existing.getEnergy());
    }

    @Override
    public String toString() {
        return "prefer-detailed";
    }
}
