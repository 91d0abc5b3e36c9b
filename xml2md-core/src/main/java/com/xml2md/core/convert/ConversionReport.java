package com.xml2md.core.convert;

import com.xml2md.core.model.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one conversion: how many nodes were dispatched and what went wrong.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * ConversionReport report = converter.convert(document, sink);
 * if (report.hasUnknownKinds()) {
 *     log.warn("Skipped: {}", report.unknownKinds());
 * }
 * }</pre>
 *
 * @param nodesDispatched nodes handed to the dispatcher, known or unknown
 * @param kindCounts handled node count per known kind
 * @param diagnostics diagnostics in the order they were reported
 */
public record ConversionReport(
    int nodesDispatched,
    Map<NodeKind, Integer> kindCounts,
    List<Diagnostic> diagnostics
) {
    /**
     * Compact constructor with validation and defaults.
     */
    public ConversionReport {
        if (nodesDispatched < 0) {
            nodesDispatched = 0;
        }
        kindCounts = kindCounts == null || kindCounts.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(kindCounts));
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Creates an empty report.
     *
     * @return empty report
     */
    public static ConversionReport empty() {
        return new ConversionReport(0, Map.of(), List.of());
    }

    /**
     * Returns the diagnostics of one type.
     *
     * @param type diagnostic type
     * @return matching diagnostics
     */
    public List<Diagnostic> diagnostics(DiagnosticType type) {
        return diagnostics.stream()
            .filter(diagnostic -> diagnostic.type() == type)
            .toList();
    }

    /**
     * Returns the distinct unknown element names, in first-seen order.
     *
     * @return unknown kinds
     */
    public Set<String> unknownKinds() {
        Set<String> kinds = new LinkedHashSet<>();
        for (Diagnostic diagnostic : diagnostics(DiagnosticType.UNKNOWN_NODE_KIND)) {
            kinds.add(diagnostic.nodeKind());
        }
        return kinds;
    }

    /**
     * Returns true if at least one unknown node kind was skipped.
     *
     * @return true if unknown kinds were met
     */
    public boolean hasUnknownKinds() {
        return diagnostics.stream().anyMatch(d -> d.type() == DiagnosticType.UNKNOWN_NODE_KIND);
    }

    /**
     * Returns how many nodes of a kind were handled.
     *
     * @param kind node kind
     * @return count, 0 if none
     */
    public int count(NodeKind kind) {
        return kindCounts.getOrDefault(kind, 0);
    }

    /**
     * Returns a human-readable summary.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Dispatched: %d, Unknown kinds: %d, System messages: %d",
            nodesDispatched,
            diagnostics(DiagnosticType.UNKNOWN_NODE_KIND).size(),
            diagnostics(DiagnosticType.SYSTEM_MESSAGE).size()
        );
    }

    /**
     * Builder for constructing a report while the traversal runs.
     */
    public static class Builder {
        private int nodesDispatched = 0;
        private final Map<NodeKind, Integer> kindCounts = new EnumMap<>(NodeKind.class);
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        public Builder incrementNodesDispatched() {
            this.nodesDispatched++;
            return this;
        }

        public Builder recordHandled(NodeKind kind) {
            kindCounts.merge(kind, 1, Integer::sum);
            return this;
        }

        public Builder addDiagnostic(Diagnostic diagnostic) {
            diagnostics.add(diagnostic);
            return this;
        }

        public ConversionReport build() {
            return new ConversionReport(nodesDispatched, kindCounts, diagnostics);
        }
    }
}
