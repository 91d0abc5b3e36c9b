package com.xml2md.core.model;

import java.util.Objects;

/**
 * A run of character data inside an element.
 *
 * @param text character data, entities already resolved
 */
public record TextNode(
    String text
) implements DocContent {
    /**
     * Compact constructor with validation.
     */
    public TextNode {
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Returns true if the text consists only of whitespace.
     *
     * @return true for blank text
     */
    public boolean isBlank() {
        return text.isBlank();
    }
}
