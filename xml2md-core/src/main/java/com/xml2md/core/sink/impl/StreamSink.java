package com.xml2md.core.sink.impl;

import com.xml2md.core.sink.OutputSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Sink that encodes output as UTF-8 onto an existing stream, typically {@code System.out}.
 *
 * <p>{@link #close()} flushes but leaves the underlying stream open, so the sink can wrap
 * the process's standard output without closing it.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * try (StreamSink sink = new StreamSink(System.out)) {
 *     converter.convert(document, sink);
 * }
 * }</pre>
 */
public class StreamSink implements OutputSink, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StreamSink.class);

    private final Writer writer;
    private long written;

    /**
     * Creates a sink writing UTF-8 to the given stream.
     *
     * @param out destination stream
     */
    public StreamSink(OutputStream out) {
        Objects.requireNonNull(out, "out must not be null");
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    @Override
    public void append(String text) {
        if (text == null) {
            return;
        }
        try {
            writer.write(text);
            written += text.length();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write to output stream", e);
        }
    }

    /**
     * Flushes buffered output to the underlying stream.
     */
    public void flush() {
        try {
            writer.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to flush output stream", e);
        }
    }

    @Override
    public void close() {
        flush();
        logger.debug("Flushed {} characters to output stream", written);
    }
}
