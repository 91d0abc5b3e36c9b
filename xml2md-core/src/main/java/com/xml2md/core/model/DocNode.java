package com.xml2md.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Read-only element of a parsed document tree.
 *
 * <p>A node carries its kind name (the XML element name, e.g. {@code section} or
 * {@code bullet_list}), its attributes, and its ordered mixed content of text runs and
 * child elements. Nodes are immutable once built and are shared freely between handlers.
 *
 * <p><b>Text:</b> {@link #text()} returns the first direct text child only, which is the
 * visible label of elements such as {@code title} or {@code reference}. Use
 * {@link #textContent()} for the concatenated text of the whole subtree.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * DocNode title = DocNode.builder("title")
 *     .text("Intro")
 *     .build();
 * DocNode section = DocNode.builder("section")
 *     .attribute("ids", "intro")
 *     .child(title)
 *     .build();
 * }</pre>
 *
 * @param kind element name
 * @param attributes attribute name to value, in document order
 * @param content ordered text and element children
 */
public record DocNode(
    String kind,
    Map<String, String> attributes,
    List<DocContent> content
) implements DocContent {
    /**
     * Compact constructor with validation.
     */
    public DocNode {
        Objects.requireNonNull(kind, "kind must not be null");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        content = content == null ? List.of() : List.copyOf(content);
    }

    /**
     * Returns the first direct text child.
     *
     * @return text of the first text child, or empty if the node has none
     */
    public Optional<String> text() {
        for (DocContent item : content) {
            if (item instanceof TextNode textNode) {
                return Optional.of(textNode.text());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the first direct text child, or an empty string.
     *
     * @return text or ""
     */
    public String textOrEmpty() {
        return text().orElse("");
    }

    /**
     * Returns the direct element children in document order.
     *
     * @return child elements
     */
    public List<DocNode> elements() {
        List<DocNode> elements = new ArrayList<>();
        for (DocContent item : content) {
            if (item instanceof DocNode node) {
                elements.add(node);
            }
        }
        return elements;
    }

    /**
     * Returns the direct text children in document order.
     *
     * @return text children
     */
    public List<TextNode> texts() {
        List<TextNode> texts = new ArrayList<>();
        for (DocContent item : content) {
            if (item instanceof TextNode textNode) {
                texts.add(textNode);
            }
        }
        return texts;
    }

    /**
     * Returns the first direct child element of the given kind.
     *
     * @param childKind element name to look for
     * @return matching child, or empty
     */
    public Optional<DocNode> firstElement(String childKind) {
        return elements().stream()
            .filter(child -> child.kind().equals(childKind))
            .findFirst();
    }

    /**
     * Streams every descendant element, depth first, excluding this node.
     *
     * @return descendant elements
     */
    public Stream<DocNode> descendants() {
        return elements().stream()
            .flatMap(child -> Stream.concat(Stream.of(child), child.descendants()));
    }

    /**
     * Reads an attribute.
     *
     * @param name attribute name
     * @return attribute value, or empty if absent
     */
    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    /**
     * Returns true if the attribute is present.
     *
     * @param name attribute name
     * @return true if present
     */
    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    /**
     * Concatenates the text of this node and all descendants in document order.
     *
     * @return full text content
     */
    public String textContent() {
        StringBuilder builder = new StringBuilder();
        appendTextContent(builder);
        return builder.toString();
    }

    private void appendTextContent(StringBuilder builder) {
        for (DocContent item : content) {
            if (item instanceof TextNode textNode) {
                builder.append(textNode.text());
            } else if (item instanceof DocNode node) {
                node.appendTextContent(builder);
            }
        }
    }

    /**
     * Creates a builder for a node of the given kind.
     *
     * @param kind element name
     * @return new builder
     */
    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    /**
     * Builder for constructing nodes incrementally.
     */
    public static class Builder {
        private final String kind;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<DocContent> content = new ArrayList<>();

        private Builder(String kind) {
            this.kind = Objects.requireNonNull(kind, "kind must not be null");
        }

        public Builder attribute(String name, String value) {
            attributes.put(name, value);
            return this;
        }

        public Builder text(String text) {
            content.add(new TextNode(text));
            return this;
        }

        public Builder child(DocNode child) {
            content.add(child);
            return this;
        }

        public Builder children(List<DocNode> children) {
            content.addAll(children);
            return this;
        }

        public DocNode build() {
            return new DocNode(kind, attributes, content);
        }
    }
}
