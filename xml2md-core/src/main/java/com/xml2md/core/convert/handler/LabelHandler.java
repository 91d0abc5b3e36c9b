package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderMode;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Renders a footnote {@code label} as a list entry carrying the footnote's anchor. Labels
 * outside footnotes (e.g. citations) are dropped.
 */
public class LabelHandler extends AbstractNodeHandler {

    private static final String ANCHOR_PREFIX = "footnote_";

    public LabelHandler() {
        super(NodeKind.LABEL);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        if (state.mode() == RenderMode.FOOTNOTE) {
            String label = node.textOrEmpty();
            context.sink().append("- <a name=\"" + anchorName(label) + "\">[" + label + "]</a> ");
        } else {
            skipped(state);
        }
        return handled(state);
    }

    static String anchorName(String label) {
        return ANCHOR_PREFIX + label;
    }
}
