package com.cstruct.extractor.extract.exception;

import com.cstruct.extractor.extract.ExtractionProblem;

/**
 * Thrown when a fail-fast extraction hits a declaration it cannot catalogue.
 */
public class ExtractionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient ExtractionProblem problem;

    public ExtractionException(ExtractionProblem problem) {
        super(problem.toString());
        this.problem = problem;
    }

    public ExtractionProblem getProblem() {
        return problem;
    }
}
