package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

/**
 * Standalone {@code image} elements render nothing. Images inside a figure are written by
 * {@link FigureHandler}, which reads them directly.
 */
public class ImageHandler extends AbstractNodeHandler {

    public ImageHandler() {
        super(NodeKind.IMAGE);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        skipped(state);
        return handled(state);
    }
}
