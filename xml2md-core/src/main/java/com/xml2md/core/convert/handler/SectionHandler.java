package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderMode;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Renders {@code section} elements: every child is dispatched in {@code SECTION} mode one
 * level deeper than the caller, so a title's heading marker length equals the number of
 * enclosing sections.
 */
public class SectionHandler extends AbstractNodeHandler {

    public SectionHandler() {
        super(NodeKind.SECTION);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        RenderState sectionState = state.withMode(RenderMode.SECTION).right();
        context.dispatchEach(sectionState, node.elements());
        return handled(state);
    }
}
