package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Renders {@code emphasis} as {@code *text*} padded with spaces, or the bare text when
 * {@code inlineMarkup} is off.
 */
public class EmphasisHandler extends AbstractNodeHandler {

    public EmphasisHandler() {
        super(NodeKind.EMPHASIS);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        String text = node.textOrEmpty();
        context.sink().append(context.options().inlineMarkup() ? " *" + text + "* " : text);
        return handled(state);
    }
}
