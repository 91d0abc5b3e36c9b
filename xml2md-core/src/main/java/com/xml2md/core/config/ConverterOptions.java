package com.xml2md.core.config;

import java.util.Objects;

/**
 * Immutable rendering toggles, resolved once before a conversion starts.
 *
 * <p>Besides heading anchors, the flags select between the behaviours of the converter
 * variants that exist in the wild, so a single handler set covers all of them.
 *
 * @param anchors emit {@code <a name="...">} anchors in section headings
 * @param referencesInBody render references that occur directly in body paragraphs
 * @param literalBlocks render {@code literal_block} elements as fenced code
 * @param inlineMarkup render {@code strong} and {@code emphasis} with Markdown markers
 *                     (otherwise their text is emitted plain)
 * @param systemMessages forward {@code system_message} contents to diagnostics
 */
public record ConverterOptions(
    boolean anchors,
    boolean referencesInBody,
    boolean literalBlocks,
    boolean inlineMarkup,
    boolean systemMessages
) {
    /**
     * Creates the default options: every feature on.
     *
     * @return default options
     */
    public static ConverterOptions defaults() {
        return new ConverterOptions(true, true, true, true, true);
    }

    /**
     * Creates default options adjusted for a profile.
     *
     * @param profile output profile
     * @return options for the profile
     */
    public static ConverterOptions forProfile(OutputProfile profile) {
        Objects.requireNonNull(profile, "profile must not be null");
        return defaults().withAnchors(profile.anchors());
    }

    public ConverterOptions withAnchors(boolean value) {
        return new ConverterOptions(value, referencesInBody, literalBlocks, inlineMarkup, systemMessages);
    }

    public ConverterOptions withReferencesInBody(boolean value) {
        return new ConverterOptions(anchors, value, literalBlocks, inlineMarkup, systemMessages);
    }

    public ConverterOptions withLiteralBlocks(boolean value) {
        return new ConverterOptions(anchors, referencesInBody, value, inlineMarkup, systemMessages);
    }

    public ConverterOptions withInlineMarkup(boolean value) {
        return new ConverterOptions(anchors, referencesInBody, literalBlocks, value, systemMessages);
    }

    public ConverterOptions withSystemMessages(boolean value) {
        return new ConverterOptions(anchors, referencesInBody, literalBlocks, inlineMarkup, value);
    }
}
