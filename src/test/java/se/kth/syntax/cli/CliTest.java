package se.kth.syntax.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import se.kth.syntax.lexer.ToyParser;
import se.kth.syntax.raw.RawSyntax;
import se.kth.syntax.raw.RawTokenSyntax;
import se.kth.syntax.raw.TokenKind;
import se.kth.syntax.serialization.RawSyntaxSerializer;

class CliTest {
    private static final String SOURCE = "foo(x: 1,\n    y: -2)\n";

    @TempDir
    Path tempDir;

    private Path writeTree(RawSyntax tree) throws IOException {
        Path path = tempDir.resolve("tree.json");
        Files.write(path, new RawSyntaxSerializer().serialize(tree).getBytes(StandardCharsets.UTF_8));
        return path;
    }

    private String run(int expectedExitCode, String... args) throws IOException {
        Path out = tempDir.resolve("out.txt");
        String[] fullArgs = new String[args.length + 2];
        System.arraycopy(args, 0, fullArgs, 0, args.length);
        fullArgs[args.length] = "-o";
        fullArgs[args.length + 1] = out.toString();

        int exitCode = Cli.commandLine().execute(fullArgs);

        assertEquals(expectedExitCode, exitCode);
        return Files.exists(out) ? new String(Files.readAllBytes(out), StandardCharsets.UTF_8) : "";
    }

    @Test
    void print_shouldReproduceSource() throws IOException {
        Path tree = writeTree(new ToyParser().parse(SOURCE));

        assertEquals(SOURCE, run(Cli.EXIT_OK, tree.toString(), "-a", "print"));
    }

    @Test
    void dumpFullTokens_shouldListTokensWithLineAndColumn() throws IOException {
        Path tree = writeTree(new ToyParser().parse(SOURCE));

        String[] lines = run(Cli.EXIT_OK, tree.toString(), "--action", "dump-full-tokens").split("\n");

        assertEquals("1:1\tidentifier\tfoo", lines[0]);
        assertEquals("2:5\tidentifier\ty", lines[6]);
        assertEquals("2:8\toper_prefix\t-", lines[8]);
        assertEquals("3:1\teof\t", lines[lines.length - 1]);
    }

    @Test
    void serializeRawTree_shouldWriteReadableTree() throws IOException {
        RawSyntax original = new ToyParser().parse(SOURCE);
        Path tree = writeTree(original);

        String json = run(Cli.EXIT_OK, tree.toString(), "-a", "serialize-raw-tree");

        assertTrue(original.isEquivalentTo(new RawSyntaxSerializer().deserialize(json)));
    }

    @Test
    void dumpTree_shouldRenderRootKind() throws IOException {
        Path tree = writeTree(new ToyParser().parse(SOURCE));

        assertTrue(run(Cli.EXIT_OK, tree.toString(), "-a", "dump-tree").startsWith("(unknown_expr\n"));
    }

    @Test
    void verify_shouldSucceed_whenExpectedSourceMatches() throws IOException {
        Path tree = writeTree(new ToyParser().parse(SOURCE));
        Path expected = tempDir.resolve("expected.txt");
        Files.write(expected, SOURCE.getBytes(StandardCharsets.UTF_8));

        String output = run(Cli.EXIT_OK, tree.toString(), "-a", "verify", "--expected-source", expected.toString());

        assertEquals("OK\n", output);
    }

    @Test
    void verify_shouldFail_andLocateMismatch_whenExpectedSourceDiffers() throws IOException {
        Path tree = writeTree(new ToyParser().parse(SOURCE));
        Path expected = tempDir.resolve("expected.txt");
        Files.write(expected, "foo(x: 1,\n    z: -2)\n".getBytes(StandardCharsets.UTF_8));

        String output = run(Cli.EXIT_ERROR, tree.toString(), "-a", "verify", "--expected-source", expected.toString());

        assertEquals("round trip mismatch at 2:5\n", output);
    }

    @Test
    void verify_shouldFail_onShapeViolation() throws IOException {
        RawSyntax call = new ToyParser().parse(SOURCE);
        RawSyntax argument = call.getChild(0).getChild(2).getChild(0);
        RawSyntax broken = call.replaceChild(0, call.getChild(0).replaceChild(2,
                call.getChild(0).getChild(2).replaceChild(0,
                        argument.replaceChild(1, RawTokenSyntax.make(TokenKind.COLON, "=")))));
        Path tree = writeTree(broken);

        String output = run(Cli.EXIT_ERROR, tree.toString(), "-a", "verify");

        assertTrue(output.startsWith("violation: FUNCTION_CALL_ARGUMENT[1]"), output);
    }

    @ParameterizedTest
    @EnumSource(Action.class)
    void everyAction_shouldExitWithError_whenInputIsMalformed(Action action) throws IOException {
        Path tree = tempDir.resolve("broken.json");
        Files.write(tree, "{\"kind\": ".getBytes(StandardCharsets.UTF_8));

        run(Cli.EXIT_ERROR, tree.toString(), "-a", action.getOptionName());
    }

    @Test
    void run_shouldExitWithError_whenInputDoesNotExist() throws IOException {
        run(Cli.EXIT_ERROR, tempDir.resolve("absent.json").toString(), "-a", "print");
    }

    @Test
    void run_shouldRejectUnknownAction() {
        int exitCode = Cli.commandLine().execute(tempDir.resolve("x.json").toString(), "-a", "explode");

        assertNotEquals(Cli.EXIT_OK, exitCode);
    }
}
