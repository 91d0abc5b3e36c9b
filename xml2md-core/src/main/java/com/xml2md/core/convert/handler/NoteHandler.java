package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderMode;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Renders {@code note} admonitions by dispatching their children in {@code NOTE} mode,
 * where paragraphs become block quotes.
 */
public class NoteHandler extends AbstractNodeHandler {

    public NoteHandler() {
        super(NodeKind.NOTE);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        context.dispatchEach(state.withMode(RenderMode.NOTE), node.elements());
        return handled(state);
    }
}
