package com.cstruct.extractor.cli.validation;

import com.cstruct.extractor.cli.exception.OptionsValidationException;
import com.cstruct.extractor.cli.model.ExtractOptions;
import com.cstruct.extractor.cli.model.ValidatedExtractOptions;
import com.cstruct.extractor.extract.config.ErrorPolicy;
import com.cstruct.extractor.extract.config.InitializerMatching;
import com.cstruct.extractor.extract.config.NestedInitializerMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class ExtractOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final ExtractOptionsValidator validator = new ExtractOptionsValidator();

    @Test
    void testValidOptionsBuildConfig() throws IOException {
        Path source = Files.writeString(tempDir.resolve("main.c"), "int x = 1;");

        ValidatedExtractOptions validated = validator.validate(
                options("-f", source.toString(), "--no-cpp", "--keep-going", "--designated", "--aggregates"));

        assertThat(validated.getSourceFile()).isEqualTo(source.toAbsolutePath().normalize());
        assertThat(validated.getConfig().getErrorPolicy()).isEqualTo(ErrorPolicy.SKIP);
        assertThat(validated.getConfig().getInitializerMatching()).isEqualTo(InitializerMatching.DESIGNATED);
        assertThat(validated.getConfig().getNestedInitializers()).isEqualTo(NestedInitializerMode.AGGREGATE);
        assertThat(validated.getPreprocessorCommand()).isNull();
    }

    @Test
    void testDefaultsArePositionalFlattenFailFast() throws IOException {
        Path source = Files.writeString(tempDir.resolve("main.c"), "int x = 1;");

        ValidatedExtractOptions validated = validator.validate(options("--file", source.toString()));

        assertThat(validated.getConfig().getErrorPolicy()).isEqualTo(ErrorPolicy.FAIL_FAST);
        assertThat(validated.getConfig().getInitializerMatching()).isEqualTo(InitializerMatching.POSITIONAL);
        assertThat(validated.getConfig().getNestedInitializers()).isEqualTo(NestedInitializerMode.FLATTEN);
    }

    @Test
    void testGccPreprocessesByDefault() throws IOException {
        Path source = Files.writeString(tempDir.resolve("main.c"), "int x = 1;");

        assertThat(validator.validate(options("-f", source.toString())).getPreprocessorCommand())
                .isEqualTo("gcc -E");
        assertThat(validator.validate(options("-f", source.toString(), "--cpp", "clang -E -I\"/opt/my headers\""))
                .getPreprocessorCommand())
                .isEqualTo("clang -E -I\"/opt/my headers\"");
    }

    @Test
    void testNoCppIgnoresBlankCommand() throws IOException {
        Path source = Files.writeString(tempDir.resolve("main.c"), "int x = 1;");

        ValidatedExtractOptions validated = validator.validate(options("-f", source.toString(), "--cpp", " ", "--no-cpp"));

        assertThat(validated.getPreprocessorCommand()).isNull();
    }

    @Test
    void testAllErrorsAreCollected() {
        ExtractOptions options = options("-f", tempDir.toString(), "--cpp", "  ");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
                        .hasSize(2)
                        .anyMatch(m -> m.contains("not a regular file"))
                        .anyMatch(m -> m.startsWith("--cpp: ")));
    }

    @Test
    void testErrorsNameTheirOption() {
        ExtractOptions options = options("-f", tempDir.resolve("absent.c").toString(), "--cpp", "");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageStartingWith("2 invalid option value(s): ")
                .satisfies(e -> assertThat(((OptionsValidationException) e).getOptionErrors())
                        .extracting(OptionsValidationException.OptionError::getOption)
                        .containsExactly("--file", "--cpp"));
    }

    @Test
    void testMissingFileIsReported() {
        ExtractOptions options = options("-f", tempDir.resolve("absent.c").toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("does not exist");
    }

    private static ExtractOptions options(String... args) {
        ExtractOptions options = new ExtractOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
