package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderMode;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;
import com.xml2md.core.sink.OutputSink;
import com.xml2md.core.util.Slugs;

/**
 * Renders {@code title} elements.
 *
 * <p><b>Output by mode:</b>
 * <ul>
 *   <li>{@code TOP} - the document title, underlined with {@code ---}; later siblings
 *       continue in {@code HEADER} mode.</li>
 *   <li>{@code BODY} - a level-one heading surrounded by blank lines (topic titles).</li>
 *   <li>{@code SECTION} - a heading with one {@code #} per enclosing section. Inline child
 *       elements such as section numbers are rendered first, then the title text, wrapped
 *       in an {@code <a name>} anchor when anchors are on.</li>
 * </ul>
 * Titles in any other mode are dropped.
 */
public class TitleHandler extends AbstractNodeHandler {

    private static final String UNDERLINE = "---";
    private static final String HEADING_MARK = "#";

    public TitleHandler() {
        super(NodeKind.TITLE);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        OutputSink sink = context.sink();
        String text = node.textOrEmpty();

        switch (state.mode()) {
            case TOP -> {
                sink.appendLine(text);
                sink.appendLine(UNDERLINE);
                return handled(state.withMode(RenderMode.HEADER));
            }
            case BODY -> {
                sink.appendLine();
                sink.appendLine(HEADING_MARK + " " + text);
                sink.appendLine();
            }
            case SECTION -> writeSectionHeading(state, node, text, context);
            default -> skipped(state);
        }
        return handled(state);
    }

    private void writeSectionHeading(RenderState state, DocNode node, String text, ConversionContext context) {
        OutputSink sink = context.sink();
        sink.append(HEADING_MARK.repeat(state.depth()));
        sink.append(" ");

        context.dispatchEach(state, node.elements());

        if (context.options().anchors()) {
            sink.append("<a name=\"" + Slugs.slug(text) + "\">" + text + "</a>");
        } else {
            sink.append(text);
        }
        sink.appendLine();
        sink.appendLine();
    }
}
