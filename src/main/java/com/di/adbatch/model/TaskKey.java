package com.di.adbatch.model;

import java.util.Objects;

/**
 * Identity of one variant task: campaign set name plus variant.
 * Serialised as {@code <name>|<variant>} for checkpoint map keys.
 */
public record TaskKey(String campaignSetName, VariantKind variant) {

    private static final char SEPARATOR = '|';

    public TaskKey {
        Objects.requireNonNull(campaignSetName, "campaignSetName");
        Objects.requireNonNull(variant, "variant");
    }

    public static TaskKey of(String campaignSetName, VariantKind variant) {
        return new TaskKey(campaignSetName, variant);
    }

    public String asString() {
        return campaignSetName + SEPARATOR + variant.wireName();
    }

    /**
     * Inverse of {@link #asString()}. The variant is taken after the last separator
     * so set names containing {@code |} still round-trip.
     *
     * @throws IllegalArgumentException if the value is not a valid key
     */
    public static TaskKey parse(String value) {
        int idx = value == null ? -1 : value.lastIndexOf(SEPARATOR);
        if (idx <= 0 || idx == value.length() - 1) {
            throw new IllegalArgumentException("Not a task key: " + value);
        }
        VariantKind variant = VariantKind.fromName(value.substring(idx + 1))
                .orElseThrow(() -> new IllegalArgumentException("Unknown variant in task key: " + value));
        return new TaskKey(value.substring(0, idx), variant);
    }

    @Override
    public String toString() {
        return campaignSetName + " (" + variant.wireName() + ")";
    }
}
