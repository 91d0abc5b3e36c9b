package com.xml2md.core.convert;

import com.xml2md.core.config.ConverterOptions;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.sink.OutputSink;
import com.xml2md.core.sink.impl.StringBuilderSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Converts a docutils document tree into Markdown.
 *
 * <p>The converter starts a fresh {@link Dispatcher} in {@link RenderState#initial()} at
 * the root node and lets the handlers write to the sink. Output is produced in a single
 * pass and is identical for identical input and options.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * DocNode document = new DocumentParser().parse(Paths.get("guide.xml"));
 * MarkdownConverter converter = new MarkdownConverter(ConverterOptions.defaults());
 *
 * try (StreamSink sink = new StreamSink(System.out)) {
 *     ConversionReport report = converter.convert(document, sink);
 * }
 * }</pre>
 */
public class MarkdownConverter {

    private static final Logger log = LoggerFactory.getLogger(MarkdownConverter.class);

    private final ConverterOptions options;

    /**
     * Creates a converter.
     *
     * @param options rendering options
     */
    public MarkdownConverter(ConverterOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Converts a document into the sink.
     *
     * @param root root node, normally the {@code document} element
     * @param sink destination for the Markdown
     * @return report with node counts and diagnostics
     */
    public ConversionReport convert(DocNode root, OutputSink sink) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(sink, "sink must not be null");

        log.info("Converting <{}> with {}", root.kind(), options);
        Dispatcher dispatcher = new Dispatcher();
        ConversionContext context = new ConversionContext(sink, options, dispatcher);
        dispatcher.dispatch(RenderState.initial(), root, context);

        ConversionReport report = dispatcher.report();
        log.info("Conversion finished. {}", report.getSummary());
        return report;
    }

    /**
     * Converts a document and returns the Markdown as a string.
     *
     * @param root root node
     * @return Markdown text
     */
    public String convertToString(DocNode root) {
        StringBuilderSink sink = new StringBuilderSink();
        convert(root, sink);
        return sink.content();
    }

    /**
     * Returns the options this converter renders with.
     *
     * @return options
     */
    public ConverterOptions options() {
        return options;
    }
}
