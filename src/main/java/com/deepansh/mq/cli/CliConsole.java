package com.deepansh.mq.cli;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Where the CLI reads and writes. Results go to out, diagnostics to err.
 */
public record CliConsole(PrintStream out, PrintStream err, InputStream in) {

    public static CliConsole system() {
        return new CliConsole(
                new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8),
                new PrintStream(new FileOutputStream(FileDescriptor.err), true, StandardCharsets.UTF_8),
                System.in);
    }
}
