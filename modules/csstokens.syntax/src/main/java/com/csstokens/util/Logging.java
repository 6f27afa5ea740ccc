package com.csstokens.util;

import java.lang.System.Logger;

/**
 * Provides the loggers used by this library.
 */
public final class Logging {

    private static final String SYNTAX_LOGGER_NAME = "csstokens.syntax";

    private static Logger syntaxLogger;

    private Logging() {}

    /**
     * Returns the logger for token rendering.
     */
    public static synchronized Logger getSyntaxLogger() {
        if (syntaxLogger == null) {
            syntaxLogger = System.getLogger(SYNTAX_LOGGER_NAME);
        }

        return syntaxLogger;
    }
}
