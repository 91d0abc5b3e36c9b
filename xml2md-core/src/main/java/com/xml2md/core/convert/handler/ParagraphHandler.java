package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;
import com.xml2md.core.model.TextNode;
import com.xml2md.core.sink.OutputSink;

/**
 * Renders {@code paragraph} elements.
 *
 * <p><b>Output by mode:</b>
 * <ul>
 *   <li>{@code BODY}, {@code SECTION} - inline content, then a blank line.</li>
 *   <li>{@code BULLET_LIST_ITEM} - inline content, then a single line break.</li>
 *   <li>{@code NOTE} - each direct text child as a {@code >} quote line plus a blank line.</li>
 *   <li>{@code FOOTNOTE} - inline content with no trailing break.</li>
 * </ul>
 */
public class ParagraphHandler extends AbstractNodeHandler {

    private static final String QUOTE = "> ";

    public ParagraphHandler() {
        super(NodeKind.PARAGRAPH);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        OutputSink sink = context.sink();

        switch (state.mode()) {
            case BODY, SECTION -> {
                writeInline(state, node, context);
                sink.appendLine();
                sink.appendLine();
            }
            case BULLET_LIST_ITEM -> {
                writeInline(state, node, context);
                sink.appendLine();
            }
            case NOTE -> {
                for (TextNode text : node.texts()) {
                    sink.appendLine(QUOTE + text.text());
                    sink.appendLine();
                }
            }
            case FOOTNOTE -> writeInline(state, node, context);
            default -> skipped(state);
        }
        return handled(state);
    }
}
