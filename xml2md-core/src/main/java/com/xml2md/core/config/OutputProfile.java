package com.xml2md.core.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Target Markdown flavour.
 *
 * <p>Profiles differ only in which {@link ConverterOptions} they turn on.
 */
public enum OutputProfile {
    /** Headings carry an inline {@code <a name>} anchor for in-page links */
    GITHUB(true),

    /** Plain headings; the target renderer builds its own anchors */
    QIITA(false);

    private final boolean anchors;

    OutputProfile(boolean anchors) {
        this.anchors = anchors;
    }

    /**
     * Returns whether headings carry an inline anchor under this profile.
     *
     * @return true if anchors are emitted
     */
    public boolean anchors() {
        return anchors;
    }

    /**
     * Resolves a profile by case-insensitive name.
     *
     * @param name profile name, e.g. "github" or "qiita"
     * @return matching profile, or empty if unknown or null
     */
    public static Optional<OutputProfile> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.strip().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
