package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderMode;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;
import com.xml2md.core.sink.OutputSink;

/**
 * Renders the bibliographic {@code docinfo} block that follows the document title as a
 * two-column table, one {@code | field | value |} row per child. Only honoured in
 * {@code HEADER} mode; afterwards the document continues in {@code BODY} mode.
 */
public class DocInfoHandler extends AbstractNodeHandler {

    public DocInfoHandler() {
        super(NodeKind.DOCINFO);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        if (state.mode() != RenderMode.HEADER) {
            skipped(state);
            return handled(state);
        }

        OutputSink sink = context.sink();
        sink.appendLine();
        for (DocNode field : node.elements()) {
            sink.appendLine("| " + field.kind() + " | " + field.textOrEmpty().strip() + " |");
        }
        sink.appendLine();
        return handled(state.withMode(RenderMode.BODY));
    }
}
