package com.cstruct.extractor.extract;

import com.cstruct.extractor.extract.model.StructTypeCatalog;
import com.cstruct.extractor.extract.model.ValueCatalog;

import lombok.Value;

@Value
public class ExtractionResult {
    String sourceName;
    StructTypeCatalog structTypes;
    ValueCatalog values;
    ExtractionDiagnostics diagnostics;
}
