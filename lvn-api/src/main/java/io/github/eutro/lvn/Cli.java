package io.github.eutro.lvn;

import io.github.eutro.lvn.passes.meta.LocalValueNumbering;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

public class Cli {
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) System.exit(status);
    }

    /**
     * Run the command line tool.
     *
     * @param args The arguments.
     * @param out  Where summaries and help go.
     * @param err  Where errors, and diagnostics without {@code --output}, go.
     * @return The exit status.
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> paths = new ArrayList<>();
        File output = null;
        int width = LocalValueNumbering.DEFAULT_COLUMN_WIDTH;
        boolean suppressFlags = false;
        for (int i = 0; i < args.length; ) {
            String arg = args[i++];
            if (!suppressFlags && arg.startsWith("-")) {
                switch (arg) {
                    case "-h":
                    case "--help":
                        printHelp(out);
                        return 0;
                    case "-o":
                    case "--output":
                        if (i == args.length) {
                            err.printf("%s: expected file%n", arg);
                            return 1;
                        }
                        if (output != null) {
                            err.printf("%s: output already specified%n", arg);
                            return 1;
                        }
                        output = new File(args[i++]);
                        break;
                    case "-w":
                    case "--width":
                        if (i == args.length) {
                            err.printf("%s: expected width%n", arg);
                            return 1;
                        }
                        String widthArg = args[i++];
                        try {
                            width = Integer.parseInt(widthArg);
                        } catch (NumberFormatException e) {
                            width = -1;
                        }
                        if (width <= 0) {
                            err.printf("%s: invalid width: \"%s\"%n", arg, widthArg);
                            return 1;
                        }
                        break;
                    case "--":
                        suppressFlags = true;
                        break;
                    default:
                        err.printf("%s: unknown flag%n", arg);
                        return 1;
                }
                continue;
            }
            paths.add(arg);
        }
        if (paths.isEmpty()) {
            printHelp(err);
            return 1;
        }

        PrintStream diagnostics = err;
        if (output != null) {
            try {
                diagnostics = new PrintStream(output, "UTF-8");
            } catch (IOException e) {
                err.printf("could not open output %s: %s%n", output, e);
                return 1;
            }
        }
        try {
            PrintStream sinkStream = diagnostics;
            ClassAnalyzer analyzer = new ClassAnalyzer(sinkStream::println, width);
            for (String path : paths) {
                File file = new File(path);
                try {
                    out.println(analyzer.analyze(file.toPath()));
                } catch (IOException e) {
                    err.printf("could not read file %s: %s%n", file, e);
                    return 1;
                } catch (IllegalArgumentException | IllegalStateException e) {
                    err.printf("could not analyze file %s: %s%n", file, e);
                    return 1;
                }
            }
        } finally {
            if (diagnostics != err) diagnostics.close();
        }
        return 0;
    }

    private static void printHelp(PrintStream out) {
        out.println(
                "usage: lvn [-h|--help] [-w|--width <n>] [-o|--output <file>] [--] <file.class> ...\n" +
                        "\n" +
                        "  <file.class> : a class file, every method of which is numbered\n" +
                        "  -w|--width <n> : pad instructions to <n> columns in diagnostics (default " +
                        LocalValueNumbering.DEFAULT_COLUMN_WIDTH + ")\n" +
                        "  -o|--output <file> : write diagnostics to <file> instead of standard error\n" +
                        "  -h|--help : show this help"
        );
    }
}
