package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocContent;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;
import com.xml2md.core.model.TextNode;
import com.xml2md.core.sink.OutputSink;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Renders a {@code literal_block} as a fenced code block.
 *
 * <p>The fence is tagged with the last token of the {@code classes} attribute, which is
 * where docutils puts the language of a {@code code} directive ({@code "code python"}).
 * Highlighted blocks arrive split into {@code inline} children; their text is written
 * verbatim, except line-number children ({@code classes="ln"}), which are dropped.
 *
 * <p>Skipped entirely when {@code literalBlocks} is off.
 */
public class LiteralBlockHandler extends AbstractNodeHandler {

    private static final String FENCE = "```";
    private static final String ATTR_CLASSES = "classes";
    private static final String LINE_NUMBER_CLASS = "ln";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public LiteralBlockHandler() {
        super(NodeKind.LITERAL_BLOCK);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        if (!context.options().literalBlocks()) {
            log.debug("Literal blocks disabled, dropping <{}>", node.kind());
            return handled(state);
        }

        OutputSink sink = context.sink();
        sink.append(FENCE);
        languageOf(node).ifPresent(sink::append);
        sink.appendLine();

        for (DocContent item : node.content()) {
            if (item instanceof TextNode text) {
                sink.append(text.text());
            } else if (item instanceof DocNode child && !isLineNumber(child)) {
                sink.append(child.textOrEmpty());
            }
        }

        sink.appendLine();
        sink.appendLine(FENCE);
        sink.appendLine();
        return handled(state);
    }

    static Optional<String> languageOf(DocNode node) {
        return node.attribute(ATTR_CLASSES)
            .map(String::strip)
            .filter(classes -> !classes.isEmpty())
            .map(classes -> {
                String[] tokens = WHITESPACE.split(classes);
                return tokens[tokens.length - 1];
            });
    }

    private static boolean isLineNumber(DocNode child) {
        return child.attribute(ATTR_CLASSES)
            .map(LINE_NUMBER_CLASS::equals)
            .orElse(false);
    }
}
