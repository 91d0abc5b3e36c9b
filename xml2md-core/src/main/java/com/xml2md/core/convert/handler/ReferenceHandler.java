package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.ConversionContext;
import com.xml2md.core.convert.HandlerResult;
import com.xml2md.core.convert.RenderState;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.NodeKind;
import com.xml2md.core.sink.OutputSink;
import com.xml2md.core.util.Slugs;

import java.util.Optional;

/**
 * Renders {@code reference} elements as Markdown links.
 *
 * <p><b>Link target</b>, first match wins:
 * <ol>
 *   <li>{@code refuri} - external link; the label falls back to the URI when the
 *       reference has no text.</li>
 *   <li>{@code refid} and {@code name} - in-page link to the slug of {@code name}.</li>
 *   <li>{@code refid} alone - in-page link to the slug of the reference text.</li>
 * </ol>
 * A reference with none of these attributes renders nothing.
 *
 * <p><b>Placement by mode:</b> in list items the reference's own child elements are
 * dispatched first and the link is followed by a line break; in footnotes the link is
 * followed by a line break; in sections, and in the body when
 * {@code referencesInBody} is on, only the link is written.
 */
public class ReferenceHandler extends AbstractNodeHandler {

    static final String ATTR_REFURI = "refuri";
    static final String ATTR_REFID = "refid";
    static final String ATTR_NAME = "name";

    public ReferenceHandler() {
        super(NodeKind.REFERENCE);
    }

    @Override
    public HandlerResult handle(RenderState state, DocNode node, ConversionContext context) {
        OutputSink sink = context.sink();

        switch (state.mode()) {
            case BULLET_LIST_ITEM -> {
                context.dispatchEach(state, node.elements());
                writeLink(node, sink);
                sink.appendLine();
            }
            case BODY -> {
                if (context.options().referencesInBody()) {
                    writeLink(node, sink);
                } else {
                    skipped(state);
                }
            }
            case SECTION -> writeLink(node, sink);
            case FOOTNOTE -> {
                writeLink(node, sink);
                sink.appendLine();
            }
            default -> skipped(state);
        }
        return handled(state);
    }

    private void writeLink(DocNode node, OutputSink sink) {
        resolveLink(node).ifPresent(link -> sink.append(" " + link + " "));
    }

    /**
     * Builds the Markdown link for a reference, without surrounding spaces.
     *
     * @param node reference node
     * @return link, or empty when the reference has no target attribute
     */
    static Optional<String> resolveLink(DocNode node) {
        String text = node.textOrEmpty();

        Optional<String> refuri = node.attribute(ATTR_REFURI);
        if (refuri.isPresent()) {
            String label = node.text().orElse(refuri.get());
            return Optional.of("[" + label + "](" + refuri.get() + ")");
        }

        if (node.hasAttribute(ATTR_REFID)) {
            String anchorSource = node.attribute(ATTR_NAME).orElse(text);
            return Optional.of("[" + text + "](#" + Slugs.slug(anchorSource) + ")");
        }

        return Optional.empty();
    }
}
