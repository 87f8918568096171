package com.cstruct.extractor.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the c-ast command the way main() does and checks exit codes and stdout.
 */
class ExtractCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();

    @Test
    void testPrintsCatalogsWithoutPreprocessing() throws IOException {
        Path source = write("""
            #include <stddef.h>

            struct config {
                int port;
                const char *host;
            };

            struct config defaults = { 8080, "localhost" };
            static int retries = 3;
            """);

        int exitCode = run("-q", "--no-cpp", "-f", source.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("""
            Struct-Types:
              config: [port, host]

            struct config defaults
              .port = Integer("8080")
              .host = StringLiteral(["localhost"])

            retries = Integer("3")

            """);
    }

    @Test
    void testMissingFileExitsWithOne() {
        int exitCode = run("-qq", "-f", tempDir.resolve("nope.c").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testSyntaxErrorExitsWithOne() throws IOException {
        Path source = write("struct broken { int a };");

        assertThat(run("-qq", "--no-cpp", "-f", source.toString())).isEqualTo(1);
    }

    @Test
    void testUnknownStructTypeFailsUnlessKeepGoing() throws IOException {
        Path source = write("""
            struct later x = { 1 };
            int y = 2;
            """);

        assertThat(run("-qq", "--no-cpp", "-f", source.toString())).isEqualTo(1);
        assertThat(out.toString()).isEmpty();

        assertThat(run("-qq", "--no-cpp", "--keep-going", "-f", source.toString())).isZero();
        assertThat(out.toString()).contains("y = Integer(\"2\")");
    }

    @Test
    void testUndefinedVariableInPathIsUsageError() {
        int exitCode = run("-qq", "-f", "$C_AST_TEST_UNDEFINED_VARIABLE/main.c");

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void testUnknownOptionIsUsageError() {
        assertThat(run("-qq", "--no-such-option")).isEqualTo(2);
    }

    @Test
    void testAggregatesOption() throws IOException {
        Path source = write("""
            struct pair { int left; int right; };
            struct pair p = { {1, 2}, 3 };
            """);

        assertThat(run("-qq", "--no-cpp", "--aggregates", "-f", source.toString())).isZero();
        assertThat(out.toString()).contains("  .left = Aggregate([Integer(\"1\"), Integer(\"2\")])");
    }

    @Test
    @EnabledIf("gccAvailable")
    void testIncludesAndMacrosAreExpandedByDefault() throws IOException {
        Path source = write("""
            #include <stdint.h>
            #define N 3

            struct S { uint8_t a; uint16_t b; };
            struct S x = {(uint8_t)1, N};
            int n = N;
            """);

        assertThat(run("-qq", "-f", source.toString())).isZero();
        assertThat(out.toString())
                .contains("  S: [a, b]")
                .contains("struct S x")
                .contains("  .b = Integer(\"3\")")
                .contains("n = Integer(\"3\")");
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void testCustomPreprocessorCommand() throws IOException {
        Path source = write("int n = N;\n");

        assertThat(run("-qq", "--cpp", "sed s/N/42/", "-f", source.toString())).isZero();
        assertThat(out.toString()).contains("n = Integer(\"42\")");
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void testFailingPreprocessorExitsWithOne() throws IOException {
        Path source = write("int n = 1;\n");

        assertThat(run("-qq", "--cpp", "false", "-f", source.toString())).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
    }

    static boolean gccAvailable() {
        try {
            Process process = new ProcessBuilder("gcc", "--version").redirectErrorStream(true).start();
            process.getInputStream().transferTo(OutputStream.nullOutputStream());
            return process.waitFor() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Path write(String content) throws IOException {
        return Files.writeString(tempDir.resolve("main.c"), content);
    }

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new ExtractCommand());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(new StringWriter()));
        return commandLine.execute(args);
    }
}
