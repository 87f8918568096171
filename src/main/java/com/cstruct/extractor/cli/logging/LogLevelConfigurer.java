package com.cstruct.extractor.cli.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * Maps repeated -v / -q flags to a root logger level. WARN is the starting point.
 */
public final class LogLevelConfigurer {

    private static final Level[] LEVELS = {
            Level.OFF, Level.ERROR, Level.WARN, Level.INFO, Level.DEBUG, Level.TRACE
    };
    private static final int DEFAULT_INDEX = 2;

    private LogLevelConfigurer() {
    }

    public static Level resolve(int verbose, int quiet) {
        int index = DEFAULT_INDEX + verbose - quiet;
        return LEVELS[Math.max(0, Math.min(LEVELS.length - 1, index))];
    }

    public static Level apply(int verbose, int quiet) {
        Level level = resolve(verbose, quiet);
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logbackRoot) {
            logbackRoot.setLevel(level);
        } else {
            root.warn("Cannot set log level {}: logging backend is not Logback", level);
        }
        return level;
    }
}
