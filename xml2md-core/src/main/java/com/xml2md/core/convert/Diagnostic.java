package com.xml2md.core.convert;

import java.util.Objects;

/**
 * A non-fatal finding reported during conversion.
 *
 * @param type diagnostic type
 * @param nodeKind element name the diagnostic is about
 * @param message human-readable message
 */
public record Diagnostic(
    DiagnosticType type,
    String nodeKind,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(nodeKind, "nodeKind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    /**
     * Creates the diagnostic for an element name no handler exists for.
     *
     * @param nodeKind unknown element name
     * @param mode mode the element was met in
     * @return diagnostic
     */
    public static Diagnostic unknownKind(String nodeKind, RenderMode mode) {
        return new Diagnostic(
            DiagnosticType.UNKNOWN_NODE_KIND,
            nodeKind,
            String.format("Unknown node kind '%s' in %s mode, skipped", nodeKind, mode));
    }

    /**
     * Creates the diagnostic for one line of an embedded system message.
     *
     * @param level message level from the document, e.g. "WARNING"; may be null
     * @param text message text
     * @return diagnostic
     */
    public static Diagnostic systemMessage(String level, String text) {
        String prefix = level == null || level.isBlank() ? "" : level + ": ";
        return new Diagnostic(DiagnosticType.SYSTEM_MESSAGE, "system_message", prefix + text);
    }
}
