package com.cstruct.extractor.cli.util;

import java.nio.file.Path;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * picocli converter for path options that applies {@link PathExpander} first.
 */
public class ShellPathConverter implements ITypeConverter<Path> {

    private final PathExpander expander;

    public ShellPathConverter() {
        this(new PathExpander());
    }

    public ShellPathConverter(PathExpander expander) {
        this.expander = expander;
    }

    @Override
    public Path convert(String value) {
        try {
            return Path.of(expander.expand(value));
        } catch (IllegalArgumentException e) {
            throw new TypeConversionException(e.getMessage());
        }
    }
}
