package com.cstruct.extractor.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import com.cstruct.extractor.parser.exception.ParseException;

/**
 * Turns the first lexer or parser error into a {@link ParseException} instead of
 * letting ANTLR print it and recover.
 */
public class ParseErrorListener extends BaseErrorListener {

    private final String sourceName;

    public ParseErrorListener(String sourceName) {
        this.sourceName = sourceName;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
            String msg, RecognitionException e) {
        throw new ParseException(sourceName + ": " + msg, line, charPositionInLine + 1);
    }
}
