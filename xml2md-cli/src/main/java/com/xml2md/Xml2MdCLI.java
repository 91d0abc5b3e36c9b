package com.xml2md;

import ch.qos.logback.classic.Level;
import com.xml2md.cli.CheckCommand;
import com.xml2md.cli.KindsCommand;
import com.xml2md.cli.OptionsResolver;
import com.xml2md.core.config.ConfigLoader;
import com.xml2md.core.config.ConverterConfig;
import com.xml2md.core.config.ConverterOptions;
import com.xml2md.core.config.OutputProfile;
import com.xml2md.core.convert.ConversionReport;
import com.xml2md.core.convert.MarkdownConverter;
import com.xml2md.core.model.DocNode;
import com.xml2md.core.parse.DocumentParser;
import com.xml2md.core.sink.impl.FileSink;
import com.xml2md.core.sink.impl.StreamSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Main CLI entry point for xml2md.
 *
 * <p>xml2md converts a docutils XML document (the output of {@code rst2xml}) into Markdown.
 * The Markdown goes to standard output unless an output file is given; logs and
 * diagnostics go to standard error.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>(none) - Convert the input document</li>
 *   <li>{@code kinds} - List the supported node kinds</li>
 *   <li>{@code check} - Report diagnostics for a document without writing Markdown</li>
 * </ul>
 *
 * <p><b>Exit codes:</b> 0 on success, also when unknown node kinds were skipped; 1 when the
 * conversion failed; 2 on usage errors; 3 when {@code --strict} is given and unknown node
 * kinds were met.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Convert to stdout
 * xml2md guide.xml
 *
 * # Qiita flavour (no heading anchors) into a file
 * xml2md --qiita -o guide.md guide.xml
 *
 * # List supported node kinds
 * xml2md kinds
 * }</pre>
 */
@Command(
    name = "xml2md",
    mixinStandardHelpOptions = true,
    version = "xml2md 1.0.0-SNAPSHOT",
    description = "Converts docutils XML documents into Markdown",
    subcommands = {
        KindsCommand.class,
        CheckCommand.class
    }
)
public class Xml2MdCLI implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(Xml2MdCLI.class);

    /** Exit code when {@code --strict} is set and unknown node kinds were skipped. */
    public static final int EXIT_UNKNOWN_KINDS = 3;

    @Parameters(index = "0", arity = "0..1", description = "docutils XML document to convert")
    private Path input;

    @Option(names = {"-o", "--output"}, description = "Output file (default: stdout)")
    private Path output;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ${DEFAULT-VALUE})")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--qiita"}, description = "Use the Qiita profile (no heading anchors)")
    private boolean qiita;

    @Option(names = {"--profile"}, description = "Output profile: ${COMPLETION-CANDIDATES}")
    private OutputProfile profile;

    @Option(names = {"--no-anchors"}, description = "Do not emit <a name> anchors in section headings")
    private boolean noAnchors;

    @Option(names = {"--strict"}, description = "Exit with code " + EXIT_UNKNOWN_KINDS + " if unknown node kinds were skipped")
    private boolean strict;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)", scope = CommandLine.ScopeType.INHERIT)
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors", scope = CommandLine.ScopeType.INHERIT)
    private boolean quiet;

    @Override
    public Integer call() {
        if (input == null) {
            System.err.println("Missing input document.");
            System.err.println("Use 'xml2md --help' to see usage");
            return CommandLine.ExitCode.USAGE;
        }

        try {
            ConverterOptions options = resolveOptions();
            log.debug("Resolved options: {}", options);

            DocNode document = new DocumentParser().parse(input);
            ConversionReport report = convert(document, options);

            if (strict && report.hasUnknownKinds()) {
                log.error("Unknown node kinds skipped: {}", report.unknownKinds());
                return EXIT_UNKNOWN_KINDS;
            }
            return CommandLine.ExitCode.OK;

        } catch (Exception e) {
            log.error("Conversion of {} failed", input, e);
            System.err.println("✗ Conversion failed: " + e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }
    }

    private ConverterOptions resolveOptions() {
        ConverterConfig config = ConfigLoader.load(configPath);
        OutputProfile profileOverride = qiita ? OutputProfile.QIITA : profile;
        if (output == null && config.outputFile() != null) {
            output = Paths.get(config.outputFile());
        }
        return OptionsResolver.resolve(config, profileOverride, noAnchors);
    }

    private ConversionReport convert(DocNode document, ConverterOptions options) {
        MarkdownConverter converter = new MarkdownConverter(options);
        if (output != null) {
            try (FileSink sink = FileSink.open(output)) {
                return converter.convert(document, sink);
            }
        }
        try (StreamSink sink = new StreamSink(System.out)) {
            return converter.convert(document, sink);
        }
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Creates the command line for this application, configuring logging before any
     * command runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        Xml2MdCLI cli = new Xml2MdCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
