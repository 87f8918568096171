package com.cstruct.extractor.extract.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A struct tag and the simple field names seen under it, in first-seen order.
 */
@Getter
@ToString
@EqualsAndHashCode
public class StructTypeDefinition {

    private final String tagName;
    @Getter(lombok.AccessLevel.NONE)
    private final List<String> fields = new ArrayList<>();

    public StructTypeDefinition(String tagName) {
        this.tagName = tagName;
    }

    public List<String> getFields() {
        return Collections.unmodifiableList(fields);
    }

    /**
     * @return false when the name was already recorded for this tag
     */
    public boolean addField(String fieldName) {
        if (fields.contains(fieldName)) {
            return false;
        }
        return fields.add(fieldName);
    }
}
