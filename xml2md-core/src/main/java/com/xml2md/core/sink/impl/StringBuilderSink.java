package com.xml2md.core.sink.impl;

import com.xml2md.core.sink.OutputSink;

/**
 * In-memory sink collecting output into a {@link StringBuilder}.
 *
 * <p>Used by tests and by callers that need the Markdown as a string.
 */
public class StringBuilderSink implements OutputSink {

    private final StringBuilder buffer = new StringBuilder();

    @Override
    public void append(String text) {
        if (text != null) {
            buffer.append(text);
        }
    }

    /**
     * Returns everything appended so far.
     *
     * @return collected text
     */
    public String content() {
        return buffer.toString();
    }

    @Override
    public String toString() {
        return content();
    }
}
