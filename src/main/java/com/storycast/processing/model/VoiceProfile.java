package com.storycast.processing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Voice attributes inferred for a character.
 *
 * <p>Every field has a default that carries no information: blank strings, the neutral
 * gender/age/accent values below and a 1.0 multiplier for pitch, speed and energy. A field is
 * considered "detailed" when it differs from its default.</p>
 */
public final class VoiceProfile {

    public static final String DEFAULT_GENDER = "male";
    public static final String DEFAULT_AGE = "middle-aged";
    public static final String DEFAULT_ACCENT = "neutral";
    public static final float DEFAULT_PITCH = 1.0f;
    public static final float DEFAULT_SPEED = 1.0f;
    public static final float DEFAULT_ENERGY = 1.0f;

    private final String gender;
    private final String age;
    private final String accent;
    private final float pitch;
    private final float speed;
    private final float energy;

    @JsonCreator
    public VoiceProfile(@JsonProperty("gender") String gender,
                        @JsonProperty("age") String age,
                        @JsonProperty("accent") String accent,
                        @JsonProperty("pitch") float pitch,
                        @JsonProperty("speed") float speed,
                        @JsonProperty("energy") float energy) {
        this.gender = gender != null ? gender.trim() : "";
        this.age = age != null ? age.trim() : "";
        this.accent = accent != null ? accent.trim() : "";
        this.pitch = pitch;
        this.speed = speed;
        this.energy = energy;
    }

    public VoiceProfile(String gender, String age, String accent) {
        this(gender, age, accent, DEFAULT_PITCH, DEFAULT_SPEED, DEFAULT_ENERGY);
    }

    public static VoiceProfile defaults() {
        return new VoiceProfile(DEFAULT_GENDER, DEFAULT_AGE, DEFAULT_ACCENT);
    }

    public String getGender() {
        return gender;
    }

    public String getAge() {
        return age;
    }

    public String getAccent() {
        return accent;
    }

    public float getPitch() {
        return pitch;
    }

    public float getSpeed() {
        return speed;
    }

    public float getEnergy() {
        return energy;
    }

    @JsonIgnore
    public boolean isGenderDefault() {
        return isDefault(gender, DEFAULT_GENDER);
    }

    @JsonIgnore
    public boolean isAgeDefault() {
        return isDefault(age, DEFAULT_AGE);
    }

    @JsonIgnore
    public boolean isAccentDefault() {
        return isDefault(accent, DEFAULT_ACCENT);
    }

    @JsonIgnore
    public boolean isPitchDefault() {
        return Float.compare(pitch, DEFAULT_PITCH) == 0;
    }

    @JsonIgnore
    public boolean isSpeedDefault() {
        return Float.compare(speed, DEFAULT_SPEED) == 0;
    }

    @JsonIgnore
    public boolean isEnergyDefault() {
        return Float.compare(energy, DEFAULT_ENERGY) == 0;
    }

    private static boolean isDefault(String value, String defaultValue) {
        return value.isEmpty() || value.equalsIgnoreCase(defaultValue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VoiceProfile)) {
            return false;
        }
        VoiceProfile that = (VoiceProfile) o;
        return Float.compare(pitch, that.pitch) == 0
                && Float.compare(speed, that.speed) == 0
                && Float.compare(energy, that.energy) == 0
                && gender.equals(that.gender)
                && age.equals(that.age)
                && accent.equals(that.accent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gender, age, accent, pitch, speed, energy);
    }

    @Override
    public String toString() {
        return "VoiceProfile{gender=" + gender + ", age=" + age + ", accent=" + accent
                + ", pitch=" + pitch + ", speed=" + speed + ", energy=" + energy + "}";
    }
}
