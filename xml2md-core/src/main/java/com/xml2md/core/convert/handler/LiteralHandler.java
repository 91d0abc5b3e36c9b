package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Renders inline {@code literal} text as a code span padded with spaces.
 */
public class LiteralHandler extends AbstractNodeHandler {

    public LiteralHandler() {
        super(NodeKind.LITERAL);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        context.sink().append(" `" + node.textOrEmpty() + "` ");
        return handled(state);
    }
}
