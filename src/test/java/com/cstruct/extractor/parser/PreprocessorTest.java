package com.cstruct.extractor.parser;

import com.cstruct.extractor.parser.service.CSourceParserService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@EnabledOnOs({ OS.LINUX, OS.MAC })
class PreprocessorTest {

    @TempDir
    Path tempDir;

    @Test
    void testOutputOfCommandIsParsed() throws IOException {
        Path source = Files.writeString(tempDir.resolve("main.c"), "int answer = 42;\n");

        TranslationUnit unit = new CSourceParserService(new Preprocessor("cat")).parse(source);

        assertThat(unit.getSourceName()).isEqualTo("main.c");
        assertThat(unit.getTree().translationUnit().externalDeclaration()).hasSize(1);
    }

    @Test
    void testQuotedArgumentsKeepTheirSpaces() throws IOException {
        Path headers = Files.createDirectories(tempDir.resolve("my headers"));
        Files.writeString(headers.resolve("extra.h"), "int from_header = 1;\n");
        Path source = Files.writeString(tempDir.resolve("main file.c"), "int from_source = 2;\n");

        Preprocessor preprocessor = new Preprocessor("cat \"" + headers.resolve("extra.h") + "\"");
        String output = preprocessor.preprocess(source);

        assertThat(output).contains("from_header").contains("from_source");
    }

    @Test
    void testCommandLineIsTrimmed() {
        assertThat(new Preprocessor("  gcc -E -P ").getCommandLine()).isEqualTo("gcc -E -P");
        assertThat(new Preprocessor().getCommandLine()).isEqualTo(Preprocessor.DEFAULT_COMMAND);
    }

    @Test
    void testFailingCommandIsAnIOException() throws IOException {
        Path source = Files.writeString(tempDir.resolve("main.c"), "int x;\n");

        assertThatThrownBy(() -> new Preprocessor("false").preprocess(source))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("exited with code");
    }

    @Test
    void testBlankCommandIsRejected() {
        assertThatThrownBy(() -> new Preprocessor(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
