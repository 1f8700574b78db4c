package io.synphot.cli.config;

import io.synphot.core.model.SynphotSettings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Command-line configuration: engine settings plus logging setup.
 *
 * @param settings      engine settings
 * @param loggingFormat {@code text} or {@code json}
 * @param loggingLevel  root log level
 * @param loggerLevels  logger name → level overrides, in configuration order
 */
public record CliConfig(
        SynphotSettings settings, String loggingFormat, String loggingLevel, Map<String, String> loggerLevels) {

    public static final String DEFAULT_LOGGING_FORMAT = "text";
    public static final String DEFAULT_LOGGING_LEVEL = "INFO";

    public CliConfig {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(loggingFormat, "loggingFormat");
        Objects.requireNonNull(loggingLevel, "loggingLevel");
        loggerLevels = Collections.unmodifiableMap(new LinkedHashMap<>(loggerLevels));
    }
}
