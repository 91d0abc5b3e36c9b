package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderMode;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Renders {@code list_item} elements as {@code * } bullets indented two spaces per list
 * nesting level (an outermost list is level one), then dispatches the item's children in
 * {@code BULLET_LIST_ITEM} mode.
 */
public class ListItemHandler extends AbstractNodeHandler {

    private static final String INDENT = "  ";
    private static final String BULLET = "* ";

    public ListItemHandler() {
        super(NodeKind.LIST_ITEM);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        RenderState itemState = state.mode() == RenderMode.BULLET_LIST
            ? state.withMode(RenderMode.BULLET_LIST_ITEM)
            : state;

        context.sink().append(INDENT.repeat(itemState.depth() + 1));
        context.sink().append(BULLET);
        context.dispatchEach(itemState, node.elements());
        return handled(state);
    }
}
