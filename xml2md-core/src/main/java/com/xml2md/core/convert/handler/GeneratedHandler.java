package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderMode;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;

import java.util.regex.Pattern;

/**
 * Renders {@code generated} text, in practice the automatic section numbers docutils puts in
 * front of a title ({@code "1.2   "}). Spaces, including the no-break padding,
 * are removed; in a section heading the number is followed by {@code ". "}.
 */
public class GeneratedHandler extends AbstractNodeHandler {

    private static final Pattern SPACES = Pattern.compile("[\\s\\u00a0]+");
    private static final String NUMBER_SUFFIX = ". ";

    public GeneratedHandler() {
        super(NodeKind.GENERATED);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        String compact = SPACES.matcher(node.textOrEmpty()).replaceAll("");
        if (state.mode() == RenderMode.SECTION) {
            context.sink().append(compact + NUMBER_SUFFIX);
        } else {
            context.sink().append(compact);
        }
        return handled(state);
    }
}
