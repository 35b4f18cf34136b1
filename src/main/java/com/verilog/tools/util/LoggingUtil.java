package com.verilog.tools.util;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

/**
 * Runtime adjustments of the logback configuration.
 */
public final class LoggingUtil {

    private static final String BASE_LOGGER = "com.verilog.tools";

    private LoggingUtil() {
        // Utility class
    }

    /**
     * Raise the tool's own loggers to DEBUG. Does nothing when logback is not the binding.
     */
    public static void enableDebug() {
        org.slf4j.Logger logger = LoggerFactory.getLogger(BASE_LOGGER);
        if (logger instanceof Logger) {
            ((Logger) logger).setLevel(Level.DEBUG);
        }
    }
}
