package com.cstruct.extractor.cli.model;

import java.nio.file.Path;

import com.cstruct.extractor.extract.config.ExtractionConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed to run an extraction. Keeps ExtractCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedExtractOptions {
    Path sourceFile;
    ExtractionConfig config;
    /** Null when the file is read without preprocessing. */
    String preprocessorCommand;
}
