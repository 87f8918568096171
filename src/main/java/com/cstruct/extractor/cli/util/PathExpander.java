package com.cstruct.extractor.cli.util;

import java.util.function.Function;

/**
 * Shell-style expansion of a path argument: a leading {@code ~} becomes the home
 * directory, {@code $VAR} and {@code ${VAR}} are replaced from the environment.
 * No globbing, no command substitution.
 */
public class PathExpander {

    private final Function<String, String> environment;
    private final String homeDirectory;

    public PathExpander() {
        this(System::getenv, System.getProperty("user.home"));
    }

    public PathExpander(Function<String, String> environment, String homeDirectory) {
        this.environment = environment;
        this.homeDirectory = homeDirectory;
    }

    /**
     * @throws IllegalArgumentException for an undefined variable or an unterminated {@code ${}
     */
    public String expand(String raw) {
        return expandVariables(expandTilde(raw));
    }

    private String expandTilde(String raw) {
        if (raw.equals("~") || raw.startsWith("~/")) {
            if (homeDirectory == null) {
                throw new IllegalArgumentException("Cannot expand '~': home directory is unknown");
            }
            return homeDirectory + raw.substring(1);
        }
        return raw;
    }

    private String expandVariables(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;

        while (i < text.length()) {
            char c = text.charAt(i);
            if (c != '$' || i + 1 >= text.length()) {
                sb.append(c);
                i++;
                continue;
            }

            if (text.charAt(i + 1) == '{') {
                int close = text.indexOf('}', i + 2);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated '${' in " + text);
                }
                sb.append(lookup(text.substring(i + 2, close)));
                i = close + 1;
                continue;
            }

            int end = i + 1;
            while (end < text.length() && isNameChar(text.charAt(end), end == i + 1)) {
                end++;
            }
            if (end == i + 1) {
                // lone '$' followed by something that is not a name
                sb.append(c);
                i++;
                continue;
            }
            sb.append(lookup(text.substring(i + 1, end)));
            i = end;
        }

        return sb.toString();
    }

    private String lookup(String name) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Empty variable name in '${}'");
        }
        String value = environment.apply(name);
        if (value == null) {
            throw new IllegalArgumentException("Environment variable " + name + " is not set");
        }
        return value;
    }

    private static boolean isNameChar(char c, boolean first) {
        if (first) {
            return Character.isLetter(c) || c == '_';
        }
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
