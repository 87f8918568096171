package com.cstruct.extractor.extract;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cstruct.extractor.extract.model.StructTypeCatalog;
import com.cstruct.extractor.extract.model.StructTypeDefinition;

import lombok.Getter;

/**
 * Accumulates field names per struct tag.
 */
public class StructTypeCatalogBuilder {
    private static final Logger log = LoggerFactory.getLogger(StructTypeCatalogBuilder.class);

    @Getter
    private final StructTypeCatalog catalog = new StructTypeCatalog();
    private final ExtractionDiagnostics diagnostics;

    public StructTypeCatalogBuilder(ExtractionDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Record a simple field name under the enclosing struct tag. Without a tag the field
     * is not recorded and a warning is emitted.
     */
    public void recordField(Optional<String> currentTag, String fieldName) {
        if (currentTag.isEmpty()) {
            String message = "Field '" + fieldName + "' is not inside a tagged struct; not recorded";
            log.warn(message);
            diagnostics.getWarnings().add(message);
            return;
        }

        StructTypeDefinition definition = catalog.getOrCreate(currentTag.get());
        if (definition.addField(fieldName)) {
            log.trace("struct {}: field {}", currentTag.get(), fieldName);
        } else {
            log.debug("struct {}: field {} already recorded", currentTag.get(), fieldName);
        }
    }
}
