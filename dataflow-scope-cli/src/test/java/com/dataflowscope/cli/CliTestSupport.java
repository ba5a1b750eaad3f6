package com.dataflowscope.cli;

import com.dataflowscope.DataflowScopeCLI;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Runs the CLI in-process and captures its output.
 */
final class CliTestSupport {

    private CliTestSupport() {
        // Utility class
    }

    static Path resource(String name) {
        try {
            return Path.of(Objects.requireNonNull(CliTestSupport.class.getResource(name), name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Invalid resource URI: " + name, e);
        }
    }

    static Result run(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine commandLine = DataflowScopeCLI.createCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        int exitCode = commandLine.execute(args);
        return new Result(exitCode, out.toString(), err.toString());
    }

    record Result(int exitCode, String out, String err) {
    }
}
