package com.xml2md.core.sink.impl;

import com.xml2md.core.sink.OutputSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Sink that writes output to a UTF-8 file.
 *
 * <p>Creates missing parent directories and overwrites an existing file. Output is written
 * incrementally as handlers append; the file is complete once the sink is closed.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * try (FileSink sink = FileSink.open(Paths.get("docs/readme.md"))) {
 *     converter.convert(document, sink);
 * }
 * // Creates: ./docs/readme.md
 * }</pre>
 */
public class FileSink implements OutputSink, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FileSink.class);

    private final Path target;
    private final BufferedWriter writer;
    private long written;

    private FileSink(Path target, BufferedWriter writer) {
        this.target = target;
        this.writer = writer;
    }

    /**
     * Opens a sink on the target file.
     *
     * @param target file to write
     * @return open sink
     * @throws IllegalStateException if the file or its parent directories cannot be created
     */
    public static FileSink open(Path target) {
        Objects.requireNonNull(target, "target must not be null");
        try {
            Path parentDir = target.toAbsolutePath().getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
                logger.debug("Output directory created/verified: {}", parentDir);
            }
            return new FileSink(target, Files.newBufferedWriter(target, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to open output file: " + target, e);
        }
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
            throw new IllegalStateException("Failed to write file: " + target, e);
        }
    }

    /**
     * Returns the file this sink writes to.
     *
     * @return target path
     */
    public Path target() {
        return target;
    }

    @Override
    public void close() {
        try {
            writer.close();
            logger.info("Wrote file: {} ({} characters)", target, written);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to close file: " + target, e);
        }
    }
}
