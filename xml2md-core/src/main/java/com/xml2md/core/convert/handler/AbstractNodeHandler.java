package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.NodeHandler;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocContent;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;
import com.xml2md.core.model.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for node handlers providing common functionality.
 *
 * <p>Provides:
 * <ul>
 *   <li>Logger initialization (one logger per handler class)</li>
 *   <li>Inline rendering of mixed content ({@link #writeInline(RenderState, DocNode, ConversionContext)})</li>
 *   <li>Result helpers ({@link #handled(RenderState)}, {@link #continueInto(DocNode, RenderState)})</li>
 * </ul>
 */
public abstract class AbstractNodeHandler implements NodeHandler {

    /**
     * Logger instance for this handler.
     * Automatically initialized with the concrete handler class name.
     */
    protected final Logger log;

    private final NodeKind kind;

    protected AbstractNodeHandler(NodeKind kind) {
        this.kind = kind;
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public NodeKind kind() {
        return kind;
    }

    /**
     * Writes a node's content inline: text children verbatim, element children dispatched
     * with the same state.
     *
     * @param state state for nested elements
     * @param node node whose content to write
     * @param context conversion context
     */
    protected void writeInline(RenderState state, DocNode node, ConversionContext context) {
        for (DocContent item : node.content()) {
            if (item instanceof TextNode textNode) {
                context.sink().append(textNode.text());
            } else if (item instanceof DocNode child) {
                context.dispatch(state, child);
            }
        }
    }

    /**
     * Logs that the node produces no output in the current mode.
     *
     * @param state current state
     */
    protected void skipped(RenderState state) {
        log.debug("<{}> renders nothing in {} mode", kind.elementName(), state.mode());
    }

    protected HandlerResult handled(RenderState state) {
        return HandlerResult.handled(state);
    }

    protected HandlerResult continueInto(DocNode node, RenderState state) {
        return HandlerResult.continueInto(node.elements(), state);
    }
}
