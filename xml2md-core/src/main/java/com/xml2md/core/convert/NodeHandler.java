package com.xml2md.core.convert;

import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Formatting logic for one {@link NodeKind}.
 *
 * <p>A handler inspects the {@link RenderState} it is given, writes to the context's sink,
 * and then either finishes the node itself (rendering whichever children it wants through
 * the context) and returns {@link HandlerResult#handled(RenderState)}, or leaves the
 * children to the dispatcher with {@link HandlerResult#continueInto}. It never does both for
 * the same children.
 *
 * <p>Handlers are stateless and shared between conversions.
 *
 * @see com.xml2md.core.convert.handler.Handlers
 */
public interface NodeHandler {

    /**
     * Returns the node kind this handler renders.
     *
     * @return node kind
     */
    NodeKind kind();

    /**
     * Renders a node.
     *
     * @param state render state at this node
     * @param node node to render; its kind is {@link #kind()}
     * @param context sink, options and recursion entry point
     * @return whether the dispatcher continues into children, and with which state
     */
    HandlerResult handle(RenderState state, DocNode node, ConversionContext context);
}
