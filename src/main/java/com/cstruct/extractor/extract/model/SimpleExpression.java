package com.cstruct.extractor.extract.model;

/**
 * Simplified view of an initializing expression. Constants keep their exact source
 * text; anything the simplifier does not interpret ends up as {@link Unrecognized}.
 */
public interface SimpleExpression {

    /**
     * Debug-style rendering, e.g. {@code Integer("0x1A")}.
     */
    String render();

    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (char c : text.toCharArray()) {
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }
}
