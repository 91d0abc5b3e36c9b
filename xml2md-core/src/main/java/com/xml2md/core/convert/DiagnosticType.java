package com.xml2md.core.convert;

/**
 * Kinds of diagnostics a conversion can produce.
 */
public enum DiagnosticType {
    /** Element name outside the known node kinds; the subtree was skipped */
    UNKNOWN_NODE_KIND,

    /** Message the document producer embedded as a {@code system_message} element */
    SYSTEM_MESSAGE
}
