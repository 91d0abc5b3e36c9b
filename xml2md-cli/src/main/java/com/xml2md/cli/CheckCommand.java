package com.xml2md.cli;

import com.xml2md.core.config.ConfigLoader;
import com.xml2md.core.config.ConverterConfig;
import com.xml2md.core.convert.ConversionReport;
import com.xml2md.core.convert.Diagnostic;
import com.xml2md.core.convert.MarkdownConverter;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.parse.DocumentParser;
import com.xml2md.core.sink.impl.DiscardingSink;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to run a conversion for its diagnostics only.
 *
 * <p>The Markdown is discarded. Diagnostics and a summary are printed to stdout. The
 * command exits with 1 if the document contains node kinds the converter does not know.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * xml2md check guide.xml
 * }</pre>
 */
@Command(
    name = "check",
    description = "Check a docutils XML document for unsupported node kinds",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(index = "0", description = "docutils XML document to check")
    private Path input;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ${DEFAULT-VALUE})")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        log.info("Checking document: {}", input);

        try {
            ConverterConfig config = ConfigLoader.load(configPath);
            DocNode document = new DocumentParser().parse(input);
            ConversionReport report = new MarkdownConverter(config.toOptions())
                .convert(document, new DiscardingSink());

            printReport(report);
            return report.hasUnknownKinds() ? 1 : 0;

        } catch (Exception e) {
            log.error("Check failed", e);
            System.err.println("✗ Check failed: " + e.getMessage());
            return 1;
        }
    }

    private void printReport(ConversionReport report) {
        System.out.println("Check Results:");
        System.out.println();

        if (report.diagnostics().isEmpty()) {
            System.out.println("  No diagnostics.");
        }
        for (Diagnostic diagnostic : report.diagnostics()) {
            System.out.printf("  • [%s] %s%n", diagnostic.type(), diagnostic.message());
        }

        System.out.println();
        System.out.println("  " + report.getSummary());
        if (report.hasUnknownKinds()) {
            System.out.println("  ✗ Unknown kinds: " + String.join(", ", report.unknownKinds()));
        } else {
            System.out.println("  ✓ All node kinds supported");
        }
    }
}
