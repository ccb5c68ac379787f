package io.github.hongjungwan.fieldlog.core.encoder;

import io.github.hongjungwan.fieldlog.api.config.LogConfig;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Record timestamp patterns. The file sink uses ISO-8601, every console sink
 * (JSON or not) the human-readable pattern.
 */
public final class TimestampFormats {

    public static final String CONSOLE_PATTERN = "yyyy-MM-dd HH:mm:ss.SSS";
    public static final String ISO8601_PATTERN = "yyyy-MM-dd'T'HH:mm:ss.SSSZ";

    private TimestampFormats() {}

    public static DateTimeFormatter forConfig(LogConfig config) {
        return ofPattern(config.isSaveToFile() ? ISO8601_PATTERN : CONSOLE_PATTERN);
    }

    public static DateTimeFormatter ofPattern(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withZone(ZoneId.systemDefault());
    }
}
