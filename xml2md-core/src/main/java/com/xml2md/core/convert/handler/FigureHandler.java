package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Renders a {@code figure} as a Markdown image whose alt text is the figure caption.
 */
public class FigureHandler extends AbstractNodeHandler {

    private static final String IMAGE = "image";
    private static final String CAPTION = "caption";
    private static final String ATTR_URI = "uri";

    public FigureHandler() {
        super(NodeKind.FIGURE);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        String uri = node.firstElement(IMAGE)
            .flatMap(image -> image.attribute(ATTR_URI))
            .orElse("");
        String caption = node.firstElement(CAPTION)
            .map(DocNode::textOrEmpty)
            .orElse("");

        context.sink().appendLine("![" + caption + "](" + uri + ")");
        context.sink().appendLine();
        return handled(state);
    }
}
