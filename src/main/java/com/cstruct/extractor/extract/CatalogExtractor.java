package com.cstruct.extractor.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cstruct.extractor.extract.config.ExtractionConfig;
import com.cstruct.extractor.parser.TranslationUnit;

/**
 * Builds the struct type catalog and the value catalog of a translation unit in one
 * pass. Each call starts from empty catalogs, so repeated runs over the same tree give
 * equal results.
 */
public class CatalogExtractor {
    private static final Logger log = LoggerFactory.getLogger(CatalogExtractor.class);

    private final ExtractionConfig config;

    public CatalogExtractor() {
        this(ExtractionConfig.defaults());
    }

    public CatalogExtractor(ExtractionConfig config) {
        this.config = config;
    }

    /**
     * @throws com.cstruct.extractor.extract.exception.ExtractionException under
     *         {@link com.cstruct.extractor.extract.config.ErrorPolicy#FAIL_FAST} when a
     *         declaration cannot be catalogued
     */
    public ExtractionResult extract(TranslationUnit translationUnit) {
        ExtractionDiagnostics diagnostics = new ExtractionDiagnostics();
        StructTypeCatalogBuilder structTypes = new StructTypeCatalogBuilder(diagnostics);
        ValueCatalogBuilder values = new ValueCatalogBuilder(structTypes.getCatalog(), new ExpressionSimplifier(),
                config);

        log.debug("Extracting {} with {}", translationUnit.getSourceName(), config);
        new DeclarationCollector(structTypes, values, config, diagnostics).visit(translationUnit.getTree());

        String summary = "Catalogued " + structTypes.getCatalog().size() + " struct types and "
                + values.getCatalog().size() + " values from " + translationUnit.getSourceName();
        diagnostics.getInfos().add(summary);
        log.info(summary);

        return new ExtractionResult(translationUnit.getSourceName(), structTypes.getCatalog(), values.getCatalog(),
                diagnostics);
    }
}
