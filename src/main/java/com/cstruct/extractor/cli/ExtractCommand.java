package com.cstruct.extractor.cli;

import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cstruct.extractor.cli.exception.OptionsValidationException;
import com.cstruct.extractor.cli.logging.LogLevelConfigurer;
import com.cstruct.extractor.cli.model.ExtractOptions;
import com.cstruct.extractor.cli.model.ValidatedExtractOptions;
import com.cstruct.extractor.cli.output.CatalogPrinter;
import com.cstruct.extractor.cli.validation.ExtractOptionsValidator;
import com.cstruct.extractor.extract.CatalogExtractor;
import com.cstruct.extractor.extract.ExtractionResult;
import com.cstruct.extractor.extract.exception.ExtractionException;
import com.cstruct.extractor.parser.Preprocessor;
import com.cstruct.extractor.parser.TranslationUnit;
import com.cstruct.extractor.parser.exception.ParseException;
import com.cstruct.extractor.parser.service.CSourceParserService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command that parses a C file and prints its struct types and initialized values.
 */
@Command(
        name = "c-ast",
        mixinStandardHelpOptions = true,
        version = "c-ast 1.0.0",
        description = "Extracts struct type definitions and initialized struct/scalar values from a C source file."
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Mixin
    private ExtractOptions options;

    @Spec
    private CommandSpec spec;

    private final ExtractOptionsValidator validator = new ExtractOptionsValidator();
    private final CatalogPrinter printer = new CatalogPrinter();

    @Override
    public Integer call() {
        LogLevelConfigurer.apply(options.getVerbosity(), options.getQuietness());

        ValidatedExtractOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        try {
            Preprocessor preprocessor = validated.getPreprocessorCommand() == null
                    ? null : new Preprocessor(validated.getPreprocessorCommand());
            TranslationUnit translationUnit = new CSourceParserService(preprocessor).parse(validated.getSourceFile());

            ExtractionResult result = new CatalogExtractor(validated.getConfig()).extract(translationUnit);
            printer.print(result, spec.commandLine().getOut());

            if (result.getDiagnostics().hasErrors()) {
                log.warn("{} declarations skipped", result.getDiagnostics().getErrors().size());
            }
            return 0;

        } catch (ParseException e) {
            log.error("Syntax error in {}: {}", validated.getSourceFile(), e.getMessage());
            return 1;
        } catch (ExtractionException e) {
            log.error("Extraction failed: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Cannot process {}", validated.getSourceFile(), e);
            return 1;
        }
    }
}
