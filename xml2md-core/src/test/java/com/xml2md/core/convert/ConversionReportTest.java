package com.xml2md.core.convert;

import com.xml2md.core.model.NodeKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConversionReport}.
 */
class ConversionReportTest {

    @Test
    void empty_hasNoDiagnostics() {
        ConversionReport report = ConversionReport.empty();

        assertThat(report.nodesDispatched()).isZero();
        assertThat(report.diagnostics()).isEmpty();
        assertThat(report.hasUnknownKinds()).isFalse();
        assertThat(report.getSummary()).isEqualTo("Dispatched: 0, Unknown kinds: 0, System messages: 0");
    }

    @Test
    void builder_collectsCountsAndDiagnostics() {
        ConversionReport report = new ConversionReport.Builder()
            .incrementNodesDispatched()
            .incrementNodesDispatched()
            .recordHandled(NodeKind.PARAGRAPH)
            .addDiagnostic(Diagnostic.unknownKind("table", RenderMode.BODY))
            .addDiagnostic(Diagnostic.systemMessage("INFO", "Hyperlink target is not referenced."))
            .build();

        assertThat(report.nodesDispatched()).isEqualTo(2);
        assertThat(report.count(NodeKind.PARAGRAPH)).isEqualTo(1);
        assertThat(report.unknownKinds()).containsExactly("table");
        assertThat(report.getSummary()).isEqualTo("Dispatched: 2, Unknown kinds: 1, System messages: 1");
    }

    @Test
    void constructor_withNegativeCount_clampsToZero() {
        assertThat(new ConversionReport(-1, null, null).nodesDispatched()).isZero();
    }

    @Test
    void systemMessage_withoutLevel_hasNoPrefix() {
        assertThat(Diagnostic.systemMessage(null, "text").message()).isEqualTo("text");
    }
}
