package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Renders a {@code footnote_reference} as {@code [[label]](#footnote_label)}, pointing at
 * the anchor {@link LabelHandler} writes.
 */
public class FootnoteReferenceHandler extends AbstractNodeHandler {

    public FootnoteReferenceHandler() {
        super(NodeKind.FOOTNOTE_REFERENCE);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        String label = node.textOrEmpty();
        context.sink().append("[[" + label + "]](#" + LabelHandler.anchorName(label) + ")");
        return handled(state);
    }
}
