package org.monkeylang.config;

import com.typesafe.config.Config;

/**
 * Settings of the interpreter, read from the {@code monkey} block of the configuration.
 *
 * @param traceParsing Whether parse functions log their entry and exit at DEBUG.
 */
public record InterpreterConfig(boolean traceParsing) {

    private static final String PARSER_TRACE = "monkey.parser.trace";

    /**
     * Maps a resolved configuration into settings.
     * @param config the resolved configuration, including the reference defaults.
     * @return the settings.
     * @throws com.typesafe.config.ConfigException if a required key is missing or has the wrong type.
     */
    public static InterpreterConfig from(Config config) {
        return new InterpreterConfig(config.getBoolean(PARSER_TRACE));
    }

    /**
     * @return the settings defined by the classpath defaults and any system property overrides.
     */
    public static InterpreterConfig defaults() {
        return from(ConfigLoader.loadDefaults());
    }
}
