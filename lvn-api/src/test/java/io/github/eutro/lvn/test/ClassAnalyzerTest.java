package io.github.eutro.lvn.test;

import io.github.eutro.lvn.ClassAnalyzer;
import io.github.eutro.lvn.numbering.ValueNumbering;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClassAnalyzerTest {
    private static final String OWNER = "io/github/eutro/lvn/test/ClassAnalyzerTest$Sample";

    @SuppressWarnings("unused")
    static abstract class Sample {
        abstract int nothing();

        native int elsewhere();

        static int square(int a, int b) {
            return a * b + b * a;
        }

        static int plain(int a) {
            return a;
        }
    }

    @Test
    void testMethods() {
        ClassAnalyzer.AnalyzedClass result = new ClassAnalyzer(line -> {
        }).analyze(Sample.class);
        assertEquals(OWNER, result.name);
        assertEquals(Arrays.asList("<init>()V", "square(II)I", "plain(I)I"), new ArrayList<>(result.methods.keySet()));
        assertEquals(1, result.getRedundantCount());
        assertEquals(OWNER + ": 3 methods, 1 redundant", result.toString());
    }

    @Test
    void testDiagnostics() {
        List<String> lines = new ArrayList<>();
        ClassAnalyzer.AnalyzedClass result = new ClassAnalyzer(lines::add).analyze(Sample.class);
        ValueNumbering square = result.methods.get("square(II)I");
        List<String> diagnostics = square.getDiagnostics();
        assertEquals("ValueNumbering: " + OWNER + ".square(II)I", diagnostics.get(0));
        assertEquals(Arrays.asList(
                String.format("%-40s %s", "store $arg0 $local0", "1 = 1"),
                String.format("%-40s %s", "store $arg1 $local1", "2 = 2"),
                String.format("%-40s %s", "$v = load $local0", "1 = 1"),
                String.format("%-40s %s", "$v.1 = load $local1", "2 = 2"),
                String.format("%-40s %s", "$v.2 = mul $v $v.1", "3 = 1 mul 2"),
                String.format("%-40s %s", "$v.3 = load $local1", "2 = 2"),
                String.format("%-40s %s", "$v.4 = load $local0", "1 = 1"),
                String.format("%-40s %s", "$v.5 = mul $v.3 $v.4", "3 = 2 mul 1 (redundant)"),
                String.format("%-40s %s", "$v.6 = add $v.2 $v.5", "4 = 3 add 3")
        ), diagnostics.subList(1, diagnostics.size()));
        // every method's lines reach the sink, in order
        int total = 0;
        for (ValueNumbering vn : result.methods.values()) total += vn.getDiagnostics().size();
        assertEquals(total, lines.size());
        assertEquals("ValueNumbering: " + OWNER + ".<init>()V", lines.get(0));
    }

    @Test
    void testColumnWidth() {
        ClassAnalyzer.AnalyzedClass result = new ClassAnalyzer(line -> {
        }, 0).analyze(Sample.class);
        List<String> diagnostics = result.methods.get("plain(I)I").getDiagnostics();
        assertEquals(Arrays.asList(
                "ValueNumbering: " + OWNER + ".plain(I)I",
                "store $arg0 $local0 1 = 1",
                "$v = load $local0 1 = 1"
        ), diagnostics);
    }

    @Test
    void testNegativeWidth() {
        assertThrows(IllegalArgumentException.class, () -> new ClassAnalyzer(line -> {
        }, -1));
    }

    @Test
    void testMalformedClass() throws IOException {
        ClassAnalyzer analyzer = new ClassAnalyzer(line -> {
        });
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> analyzer.analyze(new byte[]{1, 2, 3, 4}));
        assertEquals("malformed class file", e.getMessage());

        byte[] bytes;
        try (InputStream stream = Sample.class.getResourceAsStream("ClassAnalyzerTest$Sample.class")) {
            assertNotNull(stream);
            bytes = stream.readAllBytes();
        }
        byte[] truncated = Arrays.copyOf(bytes, bytes.length / 2);
        e = assertThrows(IllegalArgumentException.class, () -> analyzer.analyze(truncated));
        assertEquals("malformed class file", e.getMessage());
    }
}
