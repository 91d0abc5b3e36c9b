package com.xml2md.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Converter configuration file model.
 *
 * <p>Loaded from {@code xml2md.yaml}. Every entry is optional; unset option flags fall back
 * to what the selected profile provides.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * profile: github
 *
 * options:
 *   anchors: true
 *   referencesInBody: true
 *   literalBlocks: true
 *   inlineMarkup: true
 *   systemMessages: true
 *
 * output:
 *   file: "./docs/README.md"
 * }</pre>
 *
 * @param profile output profile name ("github" or "qiita")
 * @param options per-flag overrides
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConverterConfig(
    @JsonProperty("profile") String profile,
    @JsonProperty("options") OptionSettings options,
    @JsonProperty("output") OutputSettings output
) {
    /**
     * Creates a configuration with nothing set.
     *
     * @return default configuration
     */
    public static ConverterConfig defaults() {
        return new ConverterConfig(null, null, null);
    }

    /**
     * Returns the configured profile, or {@link OutputProfile#GITHUB} when unset or unknown.
     *
     * @return effective profile
     */
    public OutputProfile effectiveProfile() {
        return OutputProfile.fromName(profile).orElse(OutputProfile.GITHUB);
    }

    /**
     * Resolves the converter options: profile defaults, then any flag set in the file.
     *
     * @return resolved options
     */
    public ConverterOptions toOptions() {
        ConverterOptions resolved = ConverterOptions.forProfile(effectiveProfile());
        if (options == null) {
            return resolved;
        }
        if (options.anchors() != null) {
            resolved = resolved.withAnchors(options.anchors());
        }
        if (options.referencesInBody() != null) {
            resolved = resolved.withReferencesInBody(options.referencesInBody());
        }
        if (options.literalBlocks() != null) {
            resolved = resolved.withLiteralBlocks(options.literalBlocks());
        }
        if (options.inlineMarkup() != null) {
            resolved = resolved.withInlineMarkup(options.inlineMarkup());
        }
        if (options.systemMessages() != null) {
            resolved = resolved.withSystemMessages(options.systemMessages());
        }
        return resolved;
    }

    /**
     * Returns the configured output file, if any.
     *
     * @return output file path string or null
     */
    public String outputFile() {
        return output == null ? null : output.file();
    }

    /**
     * Option flag overrides; null means "not set".
     *
     * @param anchors heading anchors
     * @param referencesInBody references in body paragraphs
     * @param literalBlocks fenced code blocks
     * @param inlineMarkup strong/emphasis markers
     * @param systemMessages system message diagnostics
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OptionSettings(
        @JsonProperty("anchors") Boolean anchors,
        @JsonProperty("referencesInBody") Boolean referencesInBody,
        @JsonProperty("literalBlocks") Boolean literalBlocks,
        @JsonProperty("inlineMarkup") Boolean inlineMarkup,
        @JsonProperty("systemMessages") Boolean systemMessages
    ) {}

    /**
     * Output settings.
     *
     * @param file output file path; stdout when null
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("file") String file
    ) {}
}
