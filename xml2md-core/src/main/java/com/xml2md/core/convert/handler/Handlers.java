package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.NodeHandler;
import com.xml2md.core.model.NodeKind;

import java.util.Objects;

/**
 * Handler table for the closed set of node kinds.
 *
 * <p>The switch below is exhaustive over {@link NodeKind}: adding a kind without a handler
 * fails compilation. Unknown element names never get here; they are rejected by
 * {@link NodeKind#lookup(String)} at the dispatch site.
 */
public final class Handlers {

    private static final NodeHandler DOCUMENT = new DocumentHandler();
    private static final NodeHandler TITLE = new TitleHandler();
    private static final NodeHandler DOCINFO = new DocInfoHandler();
    private static final NodeHandler TOPIC = new TopicHandler();
    private static final NodeHandler PARAGRAPH = new ParagraphHandler();
    private static final NodeHandler SECTION = new SectionHandler();
    private static final NodeHandler NOTE = new NoteHandler();
    private static final NodeHandler BULLET_LIST = new BulletListHandler();
    private static final NodeHandler LIST_ITEM = new ListItemHandler();
    private static final NodeHandler REFERENCE = new ReferenceHandler();
    private static final NodeHandler FIGURE = new FigureHandler();
    private static final NodeHandler IMAGE = new ImageHandler();
    private static final NodeHandler FOOTNOTE = new FootnoteHandler();
    private static final NodeHandler FOOTNOTE_REFERENCE = new FootnoteReferenceHandler();
    private static final NodeHandler LABEL = new LabelHandler();
    private static final NodeHandler LITERAL = new LiteralHandler();
    private static final NodeHandler LITERAL_BLOCK = new LiteralBlockHandler();
    private static final NodeHandler STRONG = new StrongHandler();
    private static final NodeHandler EMPHASIS = new EmphasisHandler();
    private static final NodeHandler GENERATED = new GeneratedHandler();
    private static final NodeHandler TARGET = new TargetHandler();
    private static final NodeHandler SYSTEM_MESSAGE = new SystemMessageHandler();

    private Handlers() {
    }

    /**
     * Returns the handler for a kind.
     *
     * @param kind node kind
     * @return the kind's handler
     */
    public static NodeHandler forKind(NodeKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        return switch (kind) {
            case DOCUMENT -> DOCUMENT;
            case TITLE -> TITLE;
            case DOCINFO -> DOCINFO;
            case TOPIC -> TOPIC;
            case PARAGRAPH -> PARAGRAPH;
            case SECTION -> SECTION;
            case NOTE -> NOTE;
            case BULLET_LIST -> BULLET_LIST;
            case LIST_ITEM -> LIST_ITEM;
            case REFERENCE -> REFERENCE;
            case FIGURE -> FIGURE;
            case IMAGE -> IMAGE;
            case FOOTNOTE -> FOOTNOTE;
            case FOOTNOTE_REFERENCE -> FOOTNOTE_REFERENCE;
            case LABEL -> LABEL;
            case LITERAL -> LITERAL;
            case LITERAL_BLOCK -> LITERAL_BLOCK;
            case STRONG -> STRONG;
            case EMPHASIS -> EMPHASIS;
            case GENERATED -> GENERATED;
            case TARGET -> TARGET;
            case SYSTEM_MESSAGE -> SYSTEM_MESSAGE;
        };
    }
}
