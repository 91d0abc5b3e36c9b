package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderMode;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Renders {@code topic} blocks (e.g. a table of contents) in the document body by
 * dispatching their children in place. Topics elsewhere are dropped.
 */
public class TopicHandler extends AbstractNodeHandler {

    public TopicHandler() {
        super(NodeKind.TOPIC);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        if (state.mode() == RenderMode.BODY) {
            context.dispatchAll(state, node.elements());
        } else {
            skipped(state);
        }
        return handled(state);
    }
}
