package com.di.adbatch.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Device variant of a campaign set. Each requested variant becomes one remote campaign.
 *
 * <pre>
 *   DESKTOP     ── template clone
 *   IOS         ── template clone
 *   ANDROID     ── clone of the IOS campaign of the same set
 *   ALL_MOBILE  ── template clone (iOS + Android in one campaign)
 * </pre>
 */
public enum VariantKind {

    DESKTOP("desktop"),
    IOS("ios"),
    ANDROID("android"),
    ALL_MOBILE("all_mobile");

    private final String wireName;

    VariantKind(String wireName) {
        this.wireName = wireName;
    }

    /** Lower-case name used in input tables, checkpoint keys and reports. */
    public String wireName() {
        return wireName;
    }

    /**
     * The variant whose remote campaign this variant is cloned from, if any.
     */
    public Optional<VariantKind> predecessor() {
        return switch (this) {
            case ANDROID -> Optional.of(IOS);
            case DESKTOP, IOS, ALL_MOBILE -> Optional.empty();
        };
    }

    /**
     * Parses a variant name as written in the input table. Accepts the
     * {@code all mobile} / {@code all-mobile} / {@code mobile} spellings for {@link #ALL_MOBILE}.
     *
     * @return the variant, or empty when the name is not recognised
     */
    public static Optional<VariantKind> fromName(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if (normalized.equals("mobile")) {
            return Optional.of(ALL_MOBILE);
        }
        for (VariantKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
