package com.xml2md.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of docutils element kinds the converter knows how to render.
 *
 * <p>Any element name outside this set is an unknown kind: it is reported as a
 * diagnostic and skipped together with its subtree.
 */
public enum NodeKind {
    DOCUMENT("document"),
    TITLE("title"),
    DOCINFO("docinfo"),
    TOPIC("topic"),
    PARAGRAPH("paragraph"),
    SECTION("section"),
    NOTE("note"),
    BULLET_LIST("bullet_list"),
    LIST_ITEM("list_item"),
    REFERENCE("reference"),
    FIGURE("figure"),
    IMAGE("image"),
    FOOTNOTE("footnote"),
    FOOTNOTE_REFERENCE("footnote_reference"),
    LABEL("label"),
    LITERAL("literal"),
    LITERAL_BLOCK("literal_block"),
    STRONG("strong"),
    EMPHASIS("emphasis"),
    GENERATED("generated"),
    TARGET("target"),
    SYSTEM_MESSAGE("system_message");

    private static final Map<String, NodeKind> BY_ELEMENT_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(NodeKind::elementName, Function.identity()));

    private final String elementName;

    NodeKind(String elementName) {
        this.elementName = elementName;
    }

    /**
     * Returns the XML element name of this kind.
     *
     * @return element name, e.g. {@code bullet_list}
     */
    public String elementName() {
        return elementName;
    }

    /**
     * Resolves an element name to a kind.
     *
     * @param elementName XML element name
     * @return the kind, or empty if the name is not part of the known set
     */
    public static Optional<NodeKind> lookup(String elementName) {
        if (elementName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_ELEMENT_NAME.get(elementName));
    }
}
