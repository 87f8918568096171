package com.cstruct.extractor.parser;

import lombok.Value;

/**
 * Parse tree of one C source file together with the name it was read from.
 */
@Value
public class TranslationUnit {

    String sourceName;
    CParser.CompilationUnitContext tree;
}
