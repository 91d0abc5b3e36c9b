package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderMode;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Hands a {@code footnote}'s children back to the dispatcher, in {@code FOOTNOTE} mode when
 * the footnote sits in a section. The label and body then render as one list entry.
 */
public class FootnoteHandler extends AbstractNodeHandler {

    public FootnoteHandler() {
        super(NodeKind.FOOTNOTE);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        RenderState footnoteState = state.mode() == RenderMode.SECTION
            ? state.withMode(RenderMode.FOOTNOTE)
            : state;
        return continueInto(node, footnoteState);
    }
}
