package com.tsparser.astdump;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class AstDumpTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        AstDump.Config config = AstDump.Config.parse(args, new PrintStream(err, true, StandardCharsets.UTF_8));
        assertNotNull(config, "arguments should be accepted");
        return new AstDump(config, new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8)).run();
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private Path write(String source) throws Exception {
        Path file = tempDir.resolve("input.ts");
        Files.writeString(file, source);
        return file;
    }

    @Test
    void testPrintMode() throws Exception {
        Path file = write("let x: number = 1\nconst y = [1, 2]");
        assertEquals(0, run(file.toString()));
        assertEquals("let x: number = 1;\nconst y = [1, 2];\n", output());
    }

    @Test
    void testPrintWithoutTypes() throws Exception {
        Path file = write("let /* c */ x: number = 1");
        assertEquals(0, run("--no-types", "--no-comments", file.toString()));
        assertEquals("let x = 1;\n", output());
    }

    @Test
    void testCompactPrint() throws Exception {
        Path file = write("let x = 1;\nlet y = x + 1;");
        assertEquals(0, run("--compact", file.toString()));
        assertEquals("let x=1;let y=x+1;", output().strip());
    }

    @Test
    void testJsonMode() throws Exception {
        Path file = write("var a = 1");
        assertEquals(0, run("--mode=json", file.toString()));
        JsonNode tree = new ObjectMapper().readTree(output());
        assertEquals("Program", tree.get("type").asText());
        assertEquals("VariableStatement", tree.get("body").get(0).get("type").asText());
    }

    @Test
    void testParseErrorExitCode() throws Exception {
        Path file = write("const x");
        assertEquals(1, run(file.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("expected '='"));
    }

    @Test
    void testMissingFile() {
        assertEquals(1, run(tempDir.resolve("missing.ts").toString()));
    }

    @Test
    void testInvalidArguments() {
        PrintStream sink = new PrintStream(err, true, StandardCharsets.UTF_8);
        assertNull(AstDump.Config.parse(new String[0], sink));
        assertNull(AstDump.Config.parse(new String[]{"--mode=xml", "a.ts"}, sink));
        assertNull(AstDump.Config.parse(new String[]{"--verbose", "a.ts"}, sink));
        assertNull(AstDump.Config.parse(new String[]{"a.ts", "b.ts"}, sink));
        assertNull(AstDump.Config.parse(new String[]{"--help"}, sink));
    }

    @Test
    void testDefaults() {
        AstDump.Config config = AstDump.Config.parse(new String[]{"a.ts"}, System.err);
        assertEquals(AstDump.Mode.PRINT, config.getMode());
        assertEquals(Path.of("a.ts"), config.getFile());
    }

    @Test
    void testModeParsingIgnoresDefaultLocale() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            AstDump.Config config = AstDump.Config.parse(new String[]{"--mode=print", "a.ts"}, System.err);
            assertNotNull(config);
            assertEquals(AstDump.Mode.PRINT, config.getMode());
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void testInvalidEscapeExitsWithError() throws Exception {
        Path file = write("let s = \"\\u{110000}\"");
        assertEquals(1, run(file.toString()));
    }
}
