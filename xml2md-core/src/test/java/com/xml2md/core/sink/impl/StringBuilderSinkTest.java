package com.xml2md.core.sink.impl;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link StringBuilderSink} and {@link DiscardingSink}.
 */
class StringBuilderSinkTest {

    @Test
    void appendLine_addsLineFeed() {
        StringBuilderSink sink = new StringBuilderSink();

        sink.append("a");
        sink.appendLine("b");
        sink.appendLine();

        assertThat(sink.content()).isEqualTo("ab\n\n");
        assertThat(sink.toString()).isEqualTo(sink.content());
    }

    @Test
    void append_null_writesNothing() {
        StringBuilderSink sink = new StringBuilderSink();

        sink.append(null);

        assertThat(sink.content()).isEmpty();
    }

    @Test
    void discardingSink_countsCharactersOnly() {
        DiscardingSink sink = new DiscardingSink();

        sink.appendLine("abc");
        sink.append(null);

        assertThat(sink.discardedCharacters()).isEqualTo(4);
    }
}
