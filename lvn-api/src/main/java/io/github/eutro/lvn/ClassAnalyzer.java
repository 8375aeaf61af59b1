package io.github.eutro.lvn;

import io.github.eutro.lvn.convert.JavaToLir;
import io.github.eutro.lvn.numbering.DiagnosticSink;
import io.github.eutro.lvn.numbering.ValueNumbering;
import io.github.eutro.lvn.passes.IRPass;
import io.github.eutro.lvn.passes.meta.LocalValueNumbering;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs local value numbering over every method of a class.
 */
public class ClassAnalyzer {
    private final DiagnosticSink sink;
    private final int columnWidth;

    /**
     * @param sink        Where to send each method's diagnostics.
     * @param columnWidth The width instructions are padded to in diagnostics.
     */
    public ClassAnalyzer(DiagnosticSink sink, int columnWidth) {
        if (columnWidth < 0) throw new IllegalArgumentException("Negative column width: " + columnWidth);
        this.sink = sink;
        this.columnWidth = columnWidth;
    }

    public ClassAnalyzer(DiagnosticSink sink) {
        this(sink, LocalValueNumbering.DEFAULT_COLUMN_WIDTH);
    }

    /**
     * Analyze the class read by a class reader.
     * <p>
     * Methods without code, abstract or native, are skipped.
     *
     * @param reader The class reader.
     * @return The analyzed class.
     */
    public AnalyzedClass analyze(ClassReader reader) {
        ClassNode node = new ClassNode();
        try {
            reader.accept(node, ClassReader.SKIP_DEBUG);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("malformed class file", e);
        }
        IRPass<MethodNode, ValueNumbering> pass = new JavaToLir(node.name)
                .then(new LocalValueNumbering(sink, columnWidth));
        Map<String, ValueNumbering> methods = new LinkedHashMap<>();
        for (MethodNode method : node.methods) {
            if ((method.access & (Opcodes.ACC_ABSTRACT | Opcodes.ACC_NATIVE)) != 0) continue;
            methods.put(method.name + method.desc, pass.run(method));
        }
        return new AnalyzedClass(node.name, methods);
    }

    /**
     * Analyze a class file.
     *
     * @param bytes The bytes of the class file.
     * @return The analyzed class.
     * @throws IllegalArgumentException If the bytes are not a well-formed class file.
     */
    public AnalyzedClass analyze(byte[] bytes) {
        ClassReader reader;
        try {
            reader = new ClassReader(bytes);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("malformed class file", e);
        }
        return analyze(reader);
    }

    public AnalyzedClass analyze(InputStream stream) throws IOException {
        return analyze(stream.readAllBytes());
    }

    public AnalyzedClass analyze(Path path) throws IOException {
        return analyze(Files.readAllBytes(path));
    }

    /**
     * Analyze a loaded class, reading its bytes from its class loader.
     *
     * @param clazz The class.
     * @return The analyzed class.
     */
    public AnalyzedClass analyze(Class<?> clazz) {
        return analyze(getClassReaderFor(clazz));
    }

    /**
     * Get a class reader that reads the given class.
     *
     * @param clazz The class.
     * @return The class reader.
     */
    public static ClassReader getClassReaderFor(Class<?> clazz) {
        String path = "/" + clazz.getName().replace('.', '/') + ".class";
        try (InputStream stream = clazz.getResourceAsStream(path)) {
            if (stream == null) {
                throw new IllegalArgumentException("Could not get input stream for " + clazz);
            }
            return new ClassReader(stream);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * The results of analyzing a class.
     */
    public static class AnalyzedClass {
        /**
         * The internal name of the class.
         */
        public final String name;
        /**
         * The results for each method with code, keyed by name and descriptor, in class file order.
         */
        public final Map<String, ValueNumbering> methods;

        public AnalyzedClass(String name, Map<String, ValueNumbering> methods) {
            this.name = name;
            this.methods = Collections.unmodifiableMap(methods);
        }

        public int getRedundantCount() {
            int count = 0;
            for (ValueNumbering vn : methods.values()) {
                count += vn.getRedundant().size();
            }
            return count;
        }

        @Override
        public String toString() {
            return name + ": " + methods.size() + " methods, " + getRedundantCount() + " redundant";
        }
    }
}
