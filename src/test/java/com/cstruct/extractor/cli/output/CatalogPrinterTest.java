package com.cstruct.extractor.cli.output;

import com.cstruct.extractor.extract.CatalogExtractor;
import com.cstruct.extractor.extract.ExtractionResult;
import com.cstruct.extractor.parser.service.CSourceParserService;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class CatalogPrinterTest {

    private final CatalogPrinter printer = new CatalogPrinter();

    @Test
    void testRenderCatalogs() throws IOException {
        String source = """
            struct point { int x; int y; };
            struct point origin = { 1, 2 };
            const char *name = "demo";
            char sep = ',';
            double ratio = 0.5;
            """;

        String output = printer.render(extract(source));

        assertThat(output).isEqualTo("""
            Struct-Types:
              point: [x, y]

            struct point origin
              .x = Integer("1")
              .y = Integer("2")

            name = StringLiteral(["demo"])

            sep = Character(",")

            ratio = Float("0.5")

            """);
    }

    @Test
    void testRenderEmptyCatalogs() throws IOException {
        assertThat(printer.render(extract("int main(void) { return 0; }"))).isEqualTo("Struct-Types:\n\n");
    }

    @Test
    void testRenderUnrecognizedExpression() throws IOException {
        String output = printer.render(extract("int total = count + 1;"));

        assertThat(output).contains("total = Unrecognized((additiveExpression (primaryExpression count) + (constant 1)))");
    }

    private ExtractionResult extract(String source) {
        return new CatalogExtractor().extract(new CSourceParserService().parseSource(source, "test.c"));
    }
}
