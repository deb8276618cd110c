package se.kth.syntax.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Objects;
import java.util.concurrent.Callable;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import se.kth.syntax.exception.SyntaxException;
import se.kth.syntax.nodes.Syntax;
import se.kth.syntax.nodes.SyntaxFactory;
import se.kth.syntax.nodes.TokenSyntax;
import se.kth.syntax.raw.AbsolutePosition;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.serialization.RawSyntaxSerializer;
import se.kth.syntax.util.LazyLogger;
import se.kth.syntax.validation.SyntaxValidator;
import se.kth.syntax.validation.ValidationResult;

/**
 * Command line harness for round-trip testing. It reads a serialized raw tree, as produced by an
 * external parser, and prints, dumps, re-serializes or verifies it.
 */
public class Cli {
    private static final LazyLogger LOGGER = new LazyLogger(Cli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine() {
        return new CommandLine(new Run());
    }

    @CommandLine.Command(
            name = "fidelity-syntax",
            mixinStandardHelpOptions = true,
            description = "Print, dump and verify serialized full-fidelity syntax trees.",
            versionProvider = SyntaxVersionProvider.class)
    static class Run implements Callable<Integer> {
        @CommandLine.Parameters(
                index = "0",
                paramLabel = "INPUT",
                description = "Path to a serialized raw tree")
        File input;

        @CommandLine.Option(
                names = {"-a", "--action"},
                required = true,
                converter = Action.Converter.class,
                description = "One of: print, dump-full-tokens, serialize-raw-tree, dump-tree, verify")
        Action action;

        @CommandLine.Option(
                names = {"--expected-source"},
                description = "With verify: the source text the tree must print back to.")
        File expectedSource;

        @CommandLine.Option(
                names = {"-o", "--output"},
                description = "Path to the output file. Existing files are overwritten.")
        File out;

        @CommandLine.Option(
                names = {"-l", "--logging"},
                description = "Enable logging output")
        boolean logging;

        @Override
        public Integer call() {
            if (logging) {
                setLogLevel("DEBUG");
            }

            try {
                RawSyntax tree = readTree(input);
                StringBuilder output = new StringBuilder();
                int exitCode = perform(action, tree, output);

                if (out != null) {
                    LOGGER.info(() -> "Writing output to " + out);
                    Files.write(out.toPath(), output.toString().getBytes(StandardCharsets.UTF_8));
                } else {
                    System.out.print(output);
                }
                return exitCode;
            } catch (IOException | SyntaxException e) {
                LOGGER.error(() -> "Failed to " + action + " " + input, e);
                System.err.println("error: " + e.getMessage());
                return EXIT_ERROR;
            }
        }

        private int perform(Action action, RawSyntax tree, StringBuilder output) throws IOException {
            switch (action) {
                case PRINT:
                    tree.print(output);
                    return EXIT_OK;
                case DUMP_FULL_TOKENS:
                    output.append(dumpFullTokens(tree));
                    return EXIT_OK;
                case SERIALIZE_RAW_TREE:
                    output.append(new RawSyntaxSerializer(true).serialize(tree)).append('\n');
                    return EXIT_OK;
                case DUMP_TREE:
                    output.append(tree.dump()).append('\n');
                    return EXIT_OK;
                case VERIFY:
                    return verify(tree, output);
                default:
                    throw new IllegalStateException("Unhandled action " + action);
            }
        }

        private int verify(RawSyntax tree, StringBuilder output) throws IOException {
            ValidationResult result = SyntaxValidator.validateTree(tree);
            if (!result.isValid()) {
                result.getViolations().forEach(v -> output.append("violation: ").append(v).append('\n'));
                return EXIT_ERROR;
            }

            if (expectedSource != null) {
                String expected = new String(
                        Files.readAllBytes(expectedSource.toPath()), StandardCharsets.UTF_8);
                String printed = tree.print();
                if (!expected.equals(printed)) {
                    AbsolutePosition divergence = firstDifference(expected, printed);
                    output.append("round trip mismatch at ").append(divergence).append('\n');
                    return EXIT_ERROR;
                }
            }
            output.append("OK\n");
            return EXIT_OK;
        }
    }

    /**
     * Read a serialized raw tree from a file.
     */
    public static RawSyntax readTree(File file) throws IOException {
        LOGGER.info(() -> "Reading raw tree from " + file);
        try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            return new RawSyntaxSerializer().read(reader);
        }
    }

    /**
     * List every present token of the tree with the line and column of its text.
     */
    public static String dumpFullTokens(RawSyntax tree) {
        Syntax root = SyntaxFactory.makeTyped(tree);
        StringBuilder sb = new StringBuilder();
        for (TokenSyntax token : root.getTokens()) {
            sb.append(token.getTextPosition())
                    .append('\t')
                    .append(token.getTokenKind().name().toLowerCase())
                    .append('\t')
                    .append(token.getText())
                    .append('\n');
        }
        return sb.toString();
    }

    private static AbsolutePosition firstDifference(String expected, String printed) {
        int common = 0;
        int max = Math.min(expected.length(), printed.length());
        while (common < max && expected.charAt(common) == printed.charAt(common)) {
            common++;
        }
        return AbsolutePosition.start().advancedBy(expected.substring(0, common));
    }

    private static void setLogLevel(String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator jc = new JoranConfigurator();
        jc.setContext(context);
        context.reset();
        context.putProperty("root-level", level);
        try {
            jc.doConfigure(
                    Objects.requireNonNull(Cli.class.getClassLoader().getResource("logback.xml")));
        } catch (JoranException e) {
            LOGGER.error(() -> "Failed to set log level", e);
        }
    }
}
