package com.xml2md.core.convert.handler;

import com.xml2md.core.config.ConverterOptions;
import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.ConversionReport;
import com.xml2md.core.convert.Dispatcher;
import com.xml2md.core.convert.RenderMode;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.sink.impl.StringBuilderSink;

/**
 * Base class for handler tests.
 *
 * <p>Nodes are rendered through a real {@link Dispatcher} so nested elements reach their
 * own handlers. The state returned for later siblings and the collected report are kept for
 * assertions.
 */
abstract class HandlerTestBase {

    protected RenderState resultState;
    protected ConversionReport report;

    protected String render(RenderState state, DocNode node) {
        return render(state, node, ConverterOptions.defaults());
    }

    protected String render(RenderState state, DocNode node, ConverterOptions options) {
        StringBuilderSink sink = new StringBuilderSink();
        Dispatcher dispatcher = new Dispatcher();
        ConversionContext context = new ConversionContext(sink, options, dispatcher);

        resultState = context.dispatch(state, node);
        report = dispatcher.report();
        return sink.content();
    }

    protected static RenderState state(RenderMode mode) {
        return new RenderState(mode, 0);
    }

    protected static RenderState state(RenderMode mode, int depth) {
        return new RenderState(mode, depth);
    }

    protected static DocNode node(String kind, String text) {
        return DocNode.builder(kind).text(text).build();
    }

    protected static DocNode paragraph(String text) {
        return node("paragraph", text);
    }
}
