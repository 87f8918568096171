package com.cstruct.extractor.extract.config;

import lombok.Builder;
import lombok.Value;

/**
 * Caller policies for one extraction run.
 */
@Value
@Builder(toBuilder = true)
public class ExtractionConfig {

    @Builder.Default
    ErrorPolicy errorPolicy = ErrorPolicy.FAIL_FAST;

    @Builder.Default
    InitializerMatching initializerMatching = InitializerMatching.POSITIONAL;

    @Builder.Default
    NestedInitializerMode nestedInitializers = NestedInitializerMode.FLATTEN;

    public static ExtractionConfig defaults() {
        return builder().build();
    }
}
