package com.cstruct.extractor.extract.config;

/**
 * What the collector does with a declaration it cannot catalogue.
 */
public enum ErrorPolicy {
    /** Abort the extraction on the first problem. */
    FAIL_FAST,
    /** Record the problem as an error diagnostic and keep walking. */
    SKIP
}
