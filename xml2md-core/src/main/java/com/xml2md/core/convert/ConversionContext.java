package com.xml2md.core.convert;

import com.xml2md.core.config.ConverterOptions;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.sink.OutputSink;

import java.util.List;
import java.util.Objects;

/**
 * Everything a handler needs besides the state and the node: where to write, which options
 * are on, and how to recurse.
 *
 * @param sink output sink
 * @param options converter options, fixed for the whole conversion
 * @param dispatcher dispatcher driving this conversion
 */
public record ConversionContext(
    OutputSink sink,
    ConverterOptions options,
    Dispatcher dispatcher
) {
    /**
     * Compact constructor with validation.
     */
    public ConversionContext {
        Objects.requireNonNull(sink, "sink must not be null");
        Objects.requireNonNull(options, "options must not be null");
        Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    /**
     * Dispatches one node.
     *
     * @param state state for the node
     * @param node node to dispatch
     * @return state for the node's later siblings
     */
    public RenderState dispatch(RenderState state, DocNode node) {
        return dispatcher.dispatch(state, node, this);
    }

    /**
     * Dispatches nodes in order, each one seeing the state its predecessor left behind.
     *
     * @param state state for the first node
     * @param nodes nodes to dispatch
     * @return state after the last node
     */
    public RenderState dispatchAll(RenderState state, List<DocNode> nodes) {
        return dispatcher.dispatchAll(state, nodes, this);
    }

    /**
     * Dispatches nodes in order, each one with the same state.
     *
     * @param state state for every node
     * @param nodes nodes to dispatch
     */
    public void dispatchEach(RenderState state, List<DocNode> nodes) {
        for (DocNode node : nodes) {
            dispatcher.dispatch(state, node, this);
        }
    }

    /**
     * Reports a diagnostic for this conversion.
     *
     * @param diagnostic diagnostic to report
     */
    public void report(Diagnostic diagnostic) {
        dispatcher.report(diagnostic);
    }
}
