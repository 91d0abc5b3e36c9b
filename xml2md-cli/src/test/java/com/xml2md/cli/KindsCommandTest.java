package com.xml2md.cli;

import com.xml2md.Xml2MdCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link KindsCommand}.
 */
class KindsCommandTest {

    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void call_listsEveryKindWithItsHandler() {
        int exitCode = Xml2MdCLI.commandLine().execute("kinds");

        String output = outputStream.toString(StandardCharsets.UTF_8);
        assertThat(exitCode).isZero();
        assertThat(output).contains("Supported Node Kinds:");
        assertThat(output).contains("bullet_list (BulletListHandler)");
        assertThat(output).contains("system_message (SystemMessageHandler)");
        assertThat(output).contains("22 kinds");
    }
}
