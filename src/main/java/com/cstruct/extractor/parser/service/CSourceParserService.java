package com.cstruct.extractor.parser.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cstruct.extractor.parser.CLexer;
import com.cstruct.extractor.parser.CParser;
import com.cstruct.extractor.parser.ParseErrorListener;
import com.cstruct.extractor.parser.Preprocessor;
import com.cstruct.extractor.parser.TranslationUnit;

public class CSourceParserService {
    private static final Logger log = LoggerFactory.getLogger(CSourceParserService.class);

    private final Preprocessor preprocessor;

    public CSourceParserService() {
        this(null);
    }

    /**
     * @param preprocessor run over the file before parsing; null reads the file as is
     *                     and leaves directive lines unexpanded
     */
    public CSourceParserService(Preprocessor preprocessor) {
        this.preprocessor = preprocessor;
    }

    public TranslationUnit parse(Path path) throws IOException {
        String fileName = path.getFileName().toString();
        String content = preprocessor != null ? preprocessor.preprocess(path) : Files.readString(path);

        log.info("Parsing C source: {}", fileName);
        return parseSource(content, fileName);
    }

    /**
     * @throws com.cstruct.extractor.parser.exception.ParseException on the first
     *         lexical or syntax error
     */
    public TranslationUnit parseSource(String source, String fileName) {
        ParseErrorListener errors = new ParseErrorListener(fileName);

        CLexer lexer = new CLexer(CharStreams.fromString(source, fileName));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        CParser parser = new CParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        CParser.CompilationUnitContext tree = parser.compilationUnit();
        log.debug("Parsed {}: {} tokens", fileName, parser.getTokenStream().size());
        return new TranslationUnit(fileName, tree);
    }
}
