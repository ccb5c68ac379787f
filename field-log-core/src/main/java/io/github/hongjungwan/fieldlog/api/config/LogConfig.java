package io.github.hongjungwan.fieldlog.api.config;

import io.github.hongjungwan.fieldlog.spi.ProcessTerminator;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.OutputStream;

/**
 * Configuration for the Field Log facade.
 */
@Getter
@Builder
@ToString
public class LogConfig {

    public static final String DEFAULT_FILE_PATH = "out.log";

    /**
     * true: JSON records to {@link #filePath}, false: console sink
     */
    private final boolean saveToFile;

    /**
     * Log file path, only used when saving to file
     */
    private final String filePath;

    /**
     * Minimum level written to the sink
     */
    @Builder.Default
    private final LogLevel level = LogLevel.DEBUG;

    /**
     * Record encoding; always JSON for the file sink
     */
    @Builder.Default
    private final Encoding encoding = Encoding.CONSOLE;

    /**
     * Stack traces are attached to records at or above this level
     */
    @Builder.Default
    private final LogLevel stacktraceLevel = LogLevel.ERROR;

    /**
     * Console sink target; standard output when null
     */
    @ToString.Exclude
    private final OutputStream output;

    /**
     * Invoked after a fatal record has been written
     */
    @ToString.Exclude
    @Builder.Default
    private final ProcessTerminator terminator = ProcessTerminator.SYSTEM_EXIT;

    /**
     * Resolves raw caller options the way {@code initialize} accepts them.
     * A file sink with an empty path falls back to {@value #DEFAULT_FILE_PATH}
     * and is always JSON; the console sink is JSON only for {@code "json"}.
     */
    public static LogConfig resolve(boolean saveToFile, String filePath, String level, String... encoding) {
        LogConfigBuilder builder = builder()
                .saveToFile(saveToFile)
                .level(LogLevel.parse(level));

        if (saveToFile) {
            builder.filePath(filePath == null || filePath.isEmpty() ? DEFAULT_FILE_PATH : filePath)
                    .encoding(Encoding.JSON);
        } else {
            String requested = encoding != null && encoding.length > 0 ? encoding[0] : null;
            builder.encoding(Encoding.parse(requested));
        }
        return builder.build();
    }

    /** Console sink, DEBUG level, human-readable lines. */
    public static LogConfig defaultConfig() {
        return resolve(false, "", "debug");
    }

    /** Effective encoding: the file sink only writes JSON. */
    public Encoding getEncoding() {
        return saveToFile ? Encoding.JSON : encoding;
    }

    /** Effective file path, or null for the console sink. */
    public String getFilePath() {
        if (!saveToFile) {
            return null;
        }
        return filePath == null || filePath.isEmpty() ? DEFAULT_FILE_PATH : filePath;
    }

    /**
     * Summary written after initialization. Shows the resolved level and file
     * path, so an unrecognized level string appears as {@code level=DEBUG}.
     */
    public String describe() {
        if (saveToFile) {
            return String.format("saveToFile=%b, filePath=%s, level=%s, encoding=%s",
                    true, getFilePath(), level, getEncoding().configName());
        }
        return String.format("saveToFile=%b, level=%s, encoding=%s",
                false, level, getEncoding().configName());
    }
}
