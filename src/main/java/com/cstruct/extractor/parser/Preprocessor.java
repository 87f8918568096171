package com.cstruct.extractor.parser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external C preprocessor over a source file and returns what it writes to
 * stdout. The command line goes through the shell, so quoted arguments such as
 * {@code -I"/opt/my headers"} work; the file path is appended as the last argument.
 * The preprocessor's stderr goes to ours.
 */
public class Preprocessor {
    private static final Logger log = LoggerFactory.getLogger(Preprocessor.class);

    public static final String DEFAULT_COMMAND = "gcc -E";

    private final String commandLine;

    public Preprocessor() {
        this(DEFAULT_COMMAND);
    }

    public Preprocessor(String commandLine) {
        if (commandLine == null || commandLine.isBlank()) {
            throw new IllegalArgumentException("Preprocessor command must not be blank");
        }
        this.commandLine = commandLine.trim();
    }

    public String getCommandLine() {
        return commandLine;
    }

    public String preprocess(Path source) throws IOException {
        List<String> invocation = shellInvocation(source);
        log.debug("Running preprocessor: {}", invocation);

        Process process = new ProcessBuilder(invocation)
                .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
                .redirectError(ProcessBuilder.Redirect.INHERIT)
                .start();

        String output;
        try (InputStream stdout = process.getInputStream()) {
            output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
        }

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while waiting for preprocessor '" + commandLine + "'", e);
        }

        if (exitCode != 0) {
            throw new IOException("Preprocessor '" + commandLine + "' exited with code " + exitCode + " for " + source);
        }
        log.debug("Preprocessor produced {} characters", output.length());
        return output;
    }

    private List<String> shellInvocation(Path source) {
        if (isWindows()) {
            return List.of("cmd.exe", "/c", commandLine + " \"" + source + "\"");
        }
        // the path is passed as $1 so it never needs quoting
        return List.of("/bin/sh", "-c", commandLine + " \"$1\"", "sh", source.toString());
    }

    private static java.io.File nullDevice() {
        return new java.io.File(isWindows() ? "NUL" : "/dev/null");
    }

    private static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase().contains("win");
    }
}
