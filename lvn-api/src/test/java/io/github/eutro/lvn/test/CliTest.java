package io.github.eutro.lvn.test;

import io.github.eutro.lvn.Cli;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CliTest {
    @SuppressWarnings("unused")
    static class Sample {
        static int twice(int a, int b) {
            return (a + b) * (b + a);
        }
    }

    private static final String OWNER = "io/github/eutro/lvn/test/CliTest$Sample";

    @TempDir
    Path tmp;
    private Path classFile;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    @BeforeEach
    void writeClass() throws IOException {
        classFile = tmp.resolve("Sample.class");
        try (InputStream stream = Sample.class.getResourceAsStream("CliTest$Sample.class")) {
            assertNotNull(stream);
            Files.write(classFile, stream.readAllBytes());
        }
    }

    private int run(String... args) {
        return Cli.run(args,
                new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testSummary() {
        assertEquals(0, run(classFile.toString()));
        assertEquals(OWNER + ": 2 methods, 1 redundant" + System.lineSeparator(), out());
        assertTrue(err().contains("ValueNumbering: " + OWNER + ".twice(II)I"));
        assertTrue(err().contains(" (redundant)"));
    }

    @Test
    void testOutputFile() throws IOException {
        Path output = tmp.resolve("diagnostics.txt");
        assertEquals(0, run("-o", output.toString(), "-w", "30", "--", classFile.toString()));
        assertEquals("", err());
        List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        assertEquals("ValueNumbering: " + OWNER + ".<init>()V", lines.get(0));
        assertTrue(lines.contains(String.format("%-30s %s", "store $arg0 $local0", "1 = 1")));
    }

    @Test
    void testHelp() {
        assertEquals(0, run("--help"));
        assertTrue(out().startsWith("usage: lvn"));
    }

    @Test
    void testNoFiles() {
        assertEquals(1, run());
        assertTrue(err().startsWith("usage: lvn"));
    }

    @Test
    void testBadFlags() {
        assertEquals(1, run("--frobnicate", classFile.toString()));
        assertTrue(err().contains("unknown flag"));
    }

    @Test
    void testBadWidth() {
        assertEquals(1, run("-w", "wide", classFile.toString()));
        assertTrue(err().contains("invalid width"));
        errBytes.reset();
        assertEquals(1, run("-w", "0", classFile.toString()));
        assertTrue(err().contains("invalid width"));
        errBytes.reset();
        assertEquals(1, run("-w"));
        assertTrue(err().contains("expected width"));
    }

    @Test
    void testTruncatedFile() throws IOException {
        byte[] bytes = Files.readAllBytes(classFile);
        Path truncated = tmp.resolve("Truncated.class");
        Files.write(truncated, Arrays.copyOf(bytes, bytes.length / 2));
        assertEquals(1, run(truncated.toString()));
        assertTrue(err().startsWith("could not analyze file"), err());
        assertEquals("", out());
    }

    @Test
    void testMissingFile() {
        assertEquals(1, run(tmp.resolve("missing.class").toString()));
        assertTrue(err().startsWith("could not read file"));
    }
}
