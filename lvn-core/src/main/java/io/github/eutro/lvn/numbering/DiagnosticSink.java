package io.github.eutro.lvn.numbering;

/**
 * Where value numbering diagnostics go, one line at a time.
 */
@FunctionalInterface
public interface DiagnosticSink {
    /**
     * Accept a line. It has no trailing newline.
     *
     * @param line The line.
     */
    void emit(String line);
}
