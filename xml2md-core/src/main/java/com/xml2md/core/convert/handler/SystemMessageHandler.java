package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.Diagnostic;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Routes {@code system_message} elements (parser warnings docutils embeds in the tree) to
 * the diagnostics channel. Nothing reaches the sink. With {@code systemMessages} off the
 * messages are dropped.
 */
public class SystemMessageHandler extends AbstractNodeHandler {

    private static final String ATTR_TYPE = "type";

    public SystemMessageHandler() {
        super(NodeKind.SYSTEM_MESSAGE);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        if (!context.options().systemMessages()) {
            log.debug("System messages disabled, dropping <{}>", node.kind());
            return handled(state);
        }

        String level = node.attribute(ATTR_TYPE).orElse(null);
        for (DocNode child : node.elements()) {
            context.report(Diagnostic.systemMessage(level, child.textContent().strip()));
        }
        return handled(state);
    }
}
