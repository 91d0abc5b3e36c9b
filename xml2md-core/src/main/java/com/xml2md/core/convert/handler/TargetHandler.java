package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Hyperlink {@code target}s are resolved into references by docutils already; nothing to write.
 */
public class TargetHandler extends AbstractNodeHandler {

    public TargetHandler() {
        super(NodeKind.TARGET);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        return handled(state);
    }
}
