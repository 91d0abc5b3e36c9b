package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Root {@code document} element. Writes nothing and leaves its children to the dispatcher,
 * which threads the state through them so the title and docinfo can advance the mode.
 */
public class DocumentHandler extends AbstractNodeHandler {

    public DocumentHandler() {
        super(NodeKind.DOCUMENT);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        return continueInto(node, state);
    }
}
