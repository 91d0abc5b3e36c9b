package com.xml2md.core.parse;

import java.io.IOException;

/**
 * Signals that an input document could not be read as well-formed docutils XML.
 */
public class DocumentParseException extends IOException {

    private static final long serialVersionUID = 1L;

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
