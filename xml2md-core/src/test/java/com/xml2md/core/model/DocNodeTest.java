package com.xml2md.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DocNode}.
 */
class DocNodeTest {

    private static final DocNode PARAGRAPH = DocNode.builder("paragraph")
        .attribute("classes", "lead")
        .text("Read ")
        .child(DocNode.builder("strong").text("this").build())
        .text(" first.")
        .build();

    @Test
    void text_returnsFirstTextChildOnly() {
        assertThat(PARAGRAPH.text()).contains("Read ");
    }

    @Test
    void text_withElementFirst_skipsToFirstText() {
        DocNode title = DocNode.builder("title")
            .child(DocNode.builder("generated").text("1").build())
            .text("Intro")
            .build();

        assertThat(title.text()).contains("Intro");
    }

    @Test
    void text_withoutTextChildren_isEmpty() {
        DocNode node = DocNode.builder("section").build();

        assertThat(node.text()).isEmpty();
        assertThat(node.textOrEmpty()).isEmpty();
    }

    @Test
    void elementsAndTexts_keepDocumentOrder() {
        assertThat(PARAGRAPH.elements()).extracting(DocNode::kind).containsExactly("strong");
        assertThat(PARAGRAPH.texts()).extracting(TextNode::text).containsExactly("Read ", " first.");
    }

    @Test
    void textContent_concatenatesWholeSubtree() {
        assertThat(PARAGRAPH.textContent()).isEqualTo("Read this first.");
    }

    @Test
    void attribute_readsPresentAndAbsentNames() {
        assertThat(PARAGRAPH.attribute("classes")).contains("lead");
        assertThat(PARAGRAPH.attribute("ids")).isEmpty();
        assertThat(PARAGRAPH.hasAttribute("classes")).isTrue();
    }

    @Test
    void firstElement_findsChildByKind() {
        DocNode figure = DocNode.builder("figure")
            .child(DocNode.builder("image").attribute("uri", "a.png").build())
            .child(DocNode.builder("caption").text("A").build())
            .build();

        assertThat(figure.firstElement("caption")).map(DocNode::textOrEmpty).contains("A");
        assertThat(figure.firstElement("legend")).isEmpty();
    }

    @Test
    void descendants_walksDepthFirst() {
        DocNode tree = DocNode.builder("section")
            .child(DocNode.builder("title").text("T").build())
            .child(DocNode.builder("paragraph")
                .child(DocNode.builder("literal").text("x").build())
                .build())
            .build();

        assertThat(tree.descendants()).extracting(DocNode::kind)
            .containsExactly("title", "paragraph", "literal");
    }

    @Test
    void constructor_copiesCollections() {
        Map<String, String> attributes = new HashMap<>();
        attributes.put("ids", "a");
        DocNode node = new DocNode("section", attributes, List.of());

        attributes.put("ids", "b");

        assertThat(node.attribute("ids")).contains("a");
        assertThatThrownBy(() -> node.attributes().put("x", "y"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void constructor_withNullCollections_defaultsToEmpty() {
        DocNode node = new DocNode("section", null, null);

        assertThat(node.attributes()).isEmpty();
        assertThat(node.content()).isEmpty();
    }

    @Test
    void constructor_withNullKind_throws() {
        assertThatThrownBy(() -> new DocNode(null, Map.of(), List.of()))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("kind");
    }

    @Test
    void textNode_withNullText_throws() {
        assertThatThrownBy(() -> new TextNode(null))
            .isInstanceOf(NullPointerException.class);
    }
}
