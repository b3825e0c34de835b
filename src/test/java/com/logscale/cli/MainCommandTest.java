package com.logscale.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errorBuffer = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;
    private InputStream originalIn;

    @BeforeEach
    void captureStreams() {
        originalOut = System.out;
        originalErr = System.err;
        originalIn = System.in;
        System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errorBuffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
        System.setIn(originalIn);
    }

    @Test
    void testCallWithoutSubcommand() {
        MainCommand command = new MainCommand();
        assertEquals(0, command.call());
        assertTrue(stdout().contains("--help"));
    }

    @Test
    void testHelpOptionReturnsZero() {
        assertEquals(0, execute("--help"));
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("--width", "100", "fmt", "a.logscale");

        assertNotNull(parseResult.subcommand());
        assertEquals("format", parseResult.subcommand().commandSpec().name());
        int width = parseResult.matchedOptionValue("--width", 0);
        assertEquals(100, width);
    }

    @Test
    void testFormatPrintsToStdout() throws Exception {
        Path file = writeQuery("query.logscale", "error|count()");

        assertEquals(0, execute("format", file.toString()));
        assertEquals("error\n| count()\n", stdout());
    }

    @Test
    void testFormatHonoursGlobalWidth() throws Exception {
        Path file = writeQuery("wide.logscale", "groupBy([a, b], function=count())");

        assertEquals(0, execute("--width", "20", "format", file.toString()));
        assertEquals("groupBy(\n  [a, b],\n  function = count()\n)\n", stdout());
    }

    @Test
    void testFormatReadsStdin() {
        System.setIn(new ByteArrayInputStream("a|b".getBytes(StandardCharsets.UTF_8)));

        assertEquals(0, execute("format"));
        assertEquals("a\n| b\n", stdout());
    }

    @Test
    void testFormatCheckReportsUnformattedFiles() throws Exception {
        Path unformatted = writeQuery("bad.logscale", "error|count()");
        Path formatted = writeQuery("good.logscale", "error\n| count()\n");

        assertEquals(1, execute("format", "--check", unformatted.toString(), formatted.toString()));
        assertTrue(stderr().contains("would reformat " + unformatted));
        assertFalse(stderr().contains("would reformat " + formatted));
        assertEquals("error|count()", Files.readString(unformatted));
    }

    @Test
    void testFormatInPlaceRewritesFile() throws Exception {
        Path file = writeQuery("inplace.logscale", "x:=1|y:=2");

        assertEquals(0, execute("format", "-i", file.toString()));
        assertEquals("x := 1\n| y := 2\n", Files.readString(file));
        assertEquals("", stdout());
    }

    @Test
    void testFormatInPlaceRequiresFiles() {
        assertEquals(1, execute("format", "--in-place"));
        assertTrue(stderr().contains("--in-place requires file arguments"));
    }

    @Test
    void testFormatRejectsSyntaxErrors() throws Exception {
        Path file = writeQuery("broken.logscale", "count(x");

        assertEquals(1, execute("format", file.toString()));
        assertTrue(stderr().contains("cannot format query with syntax errors"));
        assertEquals("", stdout());
    }

    @Test
    void testMissingFileReturnsOne() {
        Path missing = tempDir.resolve("missing.logscale");

        assertEquals(1, execute("check", missing.toString()));
        assertTrue(stderr().contains("error: file not found: " + missing));
    }

    @Test
    void testCheckSubcommand() throws Exception {
        Path good = writeQuery("good.logscale", "error | count()");
        Path bad = writeQuery("bad.logscale", "f(a, b)");

        assertEquals(0, execute("check", good.toString()));
        assertTrue(stdout().contains("ok: " + good));

        assertEquals(1, execute("check", bad.toString()));
        assertTrue(stderr().contains("error: " + bad + ": syntax error detected"));
        assertTrue(stderr().contains("duplicate_unnamed_argument"));
    }

    @Test
    void testParseSubcommandSexp() throws Exception {
        Path file = writeQuery("tree.logscale", "error");

        assertEquals(0, execute("parse", file.toString()));
        assertEquals("(query (pipeline (free_text_pattern (identifier \"error\"))))", stdout().trim());
    }

    @Test
    void testParseSubcommandJsonWithMultipleFiles() throws Exception {
        Path first = writeQuery("first.logscale", "error");
        Path second = writeQuery("second.logscale", "count(");

        assertEquals(0, execute("parse", "-o", "json", first.toString(), second.toString()));
        String output = stdout();
        assertTrue(output.contains("==> " + first + " <=="));
        assertTrue(output.contains("==> " + second + " <=="));
        assertTrue(output.contains("\"has_error\" : true"));
        assertTrue(output.contains("\"has_error\" : false"));
    }

    @Test
    void testParseSubcommandRejectsUnknownFormat() throws Exception {
        Path file = writeQuery("tree.logscale", "error");

        assertEquals(1, execute("parse", "--output", "xml", file.toString()));
        assertTrue(stderr().contains("unsupported output format"));
    }

    @Test
    void testTokenizeSubcommandAlignsColumns() throws Exception {
        Path file = writeQuery("tokens.logscale", "status=200 | count()\n\nerror");

        assertEquals(0, execute("tok", "--no-color", file.toString()));
        List<String> lines = stdout().lines().toList();
        assertEquals(4, lines.size());
        assertEquals("identifier  eq  number  pipe  identifier  lparen  rparen", lines.get(0));
        assertEquals("status      =   200     |     count       (       )", lines.get(1));
        assertEquals("identifier", lines.get(2));
        assertEquals("error", lines.get(3));
    }

    @Test
    void testTokenizeRenderLineWithoutColor() throws Exception {
        MainCommand.TokenizeSubcommand tokenizeSubcommand = new MainCommand.TokenizeSubcommand();
        setField(tokenizeSubcommand, "noColor", true);

        String rendered = tokenizeSubcommand.renderLine("/re/i", Ansi.OFF);
        assertEquals("regex_body  regex_flags\n/re/        i\n", rendered);
    }

    @Test
    void testToFormatterConfigUsesOptions() throws Exception {
        MainCommand mainCommand = new MainCommand();
        setField(mainCommand, "width", 60);
        setField(mainCommand, "indent", 4);

        assertEquals(60, mainCommand.toFormatterConfig().getMaxLineWidth());
        assertEquals(4, mainCommand.toFormatterConfig().getIndentWidth());
    }

    private int execute(String... args) {
        return new CommandLine(new MainCommand()).execute(args);
    }

    private Path writeQuery(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private String stdout() {
        return outputBuffer.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return errorBuffer.toString(StandardCharsets.UTF_8);
    }

    private static void setField(Object target, String fieldName, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }
}
