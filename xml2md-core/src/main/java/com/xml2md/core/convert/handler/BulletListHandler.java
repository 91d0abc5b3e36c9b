package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderMode;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Renders {@code bullet_list} elements.
 *
 * <p>A list directly in the body or a section opens a new list scope at depth 0, whatever
 * depth an earlier sibling list reached. A list inside a list item nests one level deeper.
 * A blank line closes the outermost list only.
 */
public class BulletListHandler extends AbstractNodeHandler {

    public BulletListHandler() {
        super(NodeKind.BULLET_LIST);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        RenderState listState = switch (state.mode()) {
            case BODY, SECTION -> new RenderState(RenderMode.BULLET_LIST, 0);
            case BULLET_LIST_ITEM -> state.right();
            default -> state;
        };

        context.dispatchEach(listState, node.elements());

        if (listState.depth() == 0) {
            context.sink().appendLine();
        }
        return handled(state);
    }
}
