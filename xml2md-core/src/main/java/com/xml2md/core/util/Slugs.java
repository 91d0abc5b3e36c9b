package com.xml2md.core.util;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Builds anchor identifiers from heading and reference text.
 *
 * <p>A slug is the input lowercased with every run of whitespace collapsed to a single
 * hyphen. Leading and trailing whitespace is dropped. The function is pure: the same
 * input always yields the same slug.
 *
 * <p><b>Examples:</b>
 * <pre>{@code
 * Slugs.slug("Hello World");        // "hello-world"
 * Slugs.slug("  Getting   Started") // "getting-started"
 * }</pre>
 */
public final class Slugs {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final String SEPARATOR = "-";

    private Slugs() {
    }

    /**
     * Converts text to its slug form.
     *
     * @param text text to convert
     * @return slug
     * @throws NullPointerException if text is null
     */
    public static String slug(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        return WHITESPACE_RUN.matcher(trimmed.toLowerCase(Locale.ROOT)).replaceAll(SEPARATOR);
    }
}
