package com.xml2md.core.parse;

import com.xml2md.core.model.DocNode;
import com.xml2md.core.model.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DocumentParser}.
 */
class DocumentParserTest {

    @TempDir
    Path tempDir;

    private DocumentParser parser;

    @BeforeEach
    void setUp() {
        parser = new DocumentParser();
    }

    @Test
    void parseString_keepsMixedContentInOrder() throws DocumentParseException {
        DocNode paragraph = parser.parseString(
            "<paragraph>Use <literal>mvn</literal> to build.</paragraph>");

        assertThat(paragraph.kind()).isEqualTo("paragraph");
        assertThat(paragraph.content()).hasSize(3);
        assertThat(paragraph.texts()).extracting(TextNode::text).containsExactly("Use ", " to build.");
        assertThat(paragraph.elements()).extracting(DocNode::kind).containsExactly("literal");
    }

    @Test
    void parseString_keepsAttributes() throws DocumentParseException {
        DocNode reference = parser.parseString(
            "<reference name=\"Docs\" refuri=\"https://example.com\">Docs</reference>");

        assertThat(reference.attribute("refuri")).contains("https://example.com");
        assertThat(reference.attribute("name")).contains("Docs");
        assertThat(reference.text()).contains("Docs");
    }

    @Test
    void parseString_mergesCdataIntoText() throws DocumentParseException {
        DocNode block = parser.parseString(
            "<literal_block>if (a <![CDATA[< b]]>) {}</literal_block>");

        assertThat(block.text()).contains("if (a < b) {}");
    }

    @Test
    void parseString_dropsComments() throws DocumentParseException {
        DocNode section = parser.parseString("<section><!-- note --><title>T</title></section>");

        assertThat(section.content()).hasSize(1);
    }

    @Test
    void parseString_malformedXml_throwsParseException() {
        assertThatThrownBy(() -> parser.parseString("<document><title>Open</document>"))
            .isInstanceOf(DocumentParseException.class)
            .hasMessageContaining("Failed to parse document");
    }

    @Test
    void parse_docutilsFixtureWithDoctype_doesNotFetchDtd() throws Exception {
        Path fixture = Paths.get(getClass().getResource("/fixtures/guide.xml").toURI());

        DocNode document = parser.parse(fixture);

        assertThat(document.kind()).isEqualTo("document");
        assertThat(document.attribute("title")).contains("User Guide");
        assertThat(document.elements()).extracting(DocNode::kind)
            .containsExactly("title", "docinfo", "section");
    }

    @Test
    void parse_inputStream_readsUtf8() throws IOException {
        byte[] xml = "<title>Überblick</title>".getBytes(StandardCharsets.UTF_8);

        DocNode title = parser.parse(new ByteArrayInputStream(xml));

        assertThat(title.text()).contains("Überblick");
    }

    @Test
    void parse_missingFile_throwsIOException() {
        assertThatThrownBy(() -> parser.parse(tempDir.resolve("missing.xml")))
            .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void parse_fileWithExternalEntity_doesNotResolveIt() throws IOException {
        Path secret = tempDir.resolve("secret.txt");
        Files.writeString(secret, "TOP SECRET");
        Path input = tempDir.resolve("evil.xml");
        Files.writeString(input, "<?xml version=\"1.0\"?>\n"
            + "<!DOCTYPE paragraph [<!ENTITY leak SYSTEM \"" + secret.toUri() + "\">]>\n"
            + "<paragraph>&leak;</paragraph>");

        DocNode paragraph = parser.parse(input);

        assertThat(paragraph.textContent()).doesNotContain("TOP SECRET");
    }
}
