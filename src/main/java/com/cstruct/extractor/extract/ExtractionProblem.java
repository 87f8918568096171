package com.cstruct.extractor.extract;

import com.cstruct.extractor.parser.CParser;
import com.cstruct.extractor.parser.CTrees;

import lombok.Value;

/**
 * A declaration the value catalog could not take. Returned by the builders and
 * handled by the collector according to the configured error policy.
 */
@Value
public class ExtractionProblem {

    ProblemKind kind;
    String message;
    int line;

    public static ExtractionProblem unexpectedDeclarator(CParser.DeclaratorContext declarator) {
        return new ExtractionProblem(ProblemKind.UNEXPECTED_DECLARATOR,
                "Expected an identifier but got " + CTrees.dump(declarator), CTrees.line(declarator));
    }

    public static ExtractionProblem unknownStructType(String tag, String instanceName, int line) {
        return new ExtractionProblem(ProblemKind.UNKNOWN_STRUCT_TYPE,
                "Struct type '" + tag + "' not found for instance '" + instanceName + "'", line);
    }

    @Override
    public String toString() {
        return kind + " at line " + line + ": " + message;
    }
}
