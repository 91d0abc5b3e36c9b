package com.xml2md.core.sink;

/**
 * Append-only text destination for converted Markdown.
 *
 * <p>Handlers write through two primitives only: {@link #append(String)} for raw text and
 * {@link #appendLine(String)} for text followed by a line feed. Nothing written can be taken
 * back, so a conversion that stops midway leaves a valid prefix in the sink.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class StringBuilderSink implements OutputSink {
 *     private final StringBuilder buffer = new StringBuilder();
 *
 *     @Override
 *     public void append(String text) {
 *         buffer.append(text);
 *     }
 * }
 * }</pre>
 *
 * <p>Line endings are always {@code "\n"} regardless of platform.
 *
 * @see com.xml2md.core.sink.impl.StringBuilderSink
 * @see com.xml2md.core.sink.impl.PrintStreamSink
 * @see com.xml2md.core.sink.impl.FileSink
 */
public interface OutputSink {

    /** Line terminator used by {@link #appendLine(String)}. */
    String LINE_END = "\n";

    /**
     * Appends text as is.
     *
     * @param text text to append; null is written as nothing
     * @throws IllegalStateException if the underlying destination fails
     */
    void append(String text);

    /**
     * Appends text followed by a line feed.
     *
     * @param text text to append; null is written as nothing
     * @throws IllegalStateException if the underlying destination fails
     */
    default void appendLine(String text) {
        append(text);
        append(LINE_END);
    }

    /**
     * Appends an empty line.
     */
    default void appendLine() {
        append(LINE_END);
    }
}
