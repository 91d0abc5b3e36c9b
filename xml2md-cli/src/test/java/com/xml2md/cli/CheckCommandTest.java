package com.xml2md.cli;

import com.xml2md.Xml2MdCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CheckCommand}.
 */
class CheckCommandTest {

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int check(String xml) throws IOException {
        Path input = tempDir.resolve("doc.xml");
        Files.writeString(input, xml, StandardCharsets.UTF_8);
        return Xml2MdCLI.commandLine().execute(
            "check", "-c", tempDir.resolve("absent.yaml").toString(), input.toString());
    }

    @Test
    void call_documentWithUnknownKinds_listsThemAndReturnsOne() throws IOException {
        int exitCode = check("<document><title>T</title><table/><sidebar/></document>");

        String output = outputStream.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isEqualTo(1);
        assertThat(output).contains("Unknown node kind 'table'");
        assertThat(output).contains("Unknown kinds: table, sidebar");
        assertThat(output).doesNotContain("T\n---");
    }

    @Test
    void call_cleanDocument_returnsZero() throws IOException {
        int exitCode = check("<document><title>T</title></document>");

        String output = outputStream.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(output).contains("No diagnostics.").contains("All node kinds supported");
    }

    @Test
    void call_documentWithSystemMessage_listsItWithoutFailing() throws IOException {
        int exitCode = check("<document><section><system_message type=\"INFO\">"
            + "<paragraph>Unreferenced target.</paragraph></system_message></section></document>");

        String output = outputStream.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(output).contains("[SYSTEM_MESSAGE] INFO: Unreferenced target.");
    }

    @Test
    void call_malformedDocument_returnsOne() throws IOException {
        assertThat(check("<document>")).isEqualTo(1);
    }
}
