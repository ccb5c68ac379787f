package io.github.hongjungwan.fieldlog.core.internal;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import io.github.hongjungwan.fieldlog.api.config.LogLevel;
import io.github.hongjungwan.fieldlog.api.field.Field;
import org.slf4j.Marker;
import org.slf4j.event.KeyValuePair;

import java.util.ArrayList;
import java.util.List;

/**
 * 초기화 1회당 하나씩 생성되는 Logback 엔진. 전용 LoggerContext와 sink appender 보유.
 *
 * <p>Safe for concurrent use once built; the appender does its own locking.</p>
 */
public class LogEngine {

    private static final String FQCN = DefaultStructuredLogger.class.getName();

    private final LogConfig config;
    private final LoggerContext loggerContext;
    private final Logger logger;

    LogEngine(LogConfig config, LoggerContext loggerContext, Logger logger) {
        this.config = config;
        this.loggerContext = loggerContext;
        this.logger = logger;
    }

    public LogConfig getConfig() {
        return config;
    }

    public boolean isEnabled(LogLevel level) {
        return logger.isEnabledFor(RecordLevels.toLogback(level));
    }

    /** 레코드 1건을 sink에 기록 */
    public void write(LogLevel level, String message, List<Field> fields, StackTraceElement[] callerData) {
        LoggingEvent event = new LoggingEvent(FQCN, logger, RecordLevels.toLogback(level), message, null, null);
        event.setCallerData(callerData);

        Marker marker = RecordLevels.markerFor(level);
        if (marker != null) {
            event.addMarker(marker);
        }

        if (!fields.isEmpty()) {
            List<KeyValuePair> pairs = new ArrayList<>(fields.size());
            for (Field field : fields) {
                pairs.add(new KeyValuePair(field.getKey(), field));
            }
            event.setKeyValuePairs(pairs);
        }

        logger.callAppenders(event);
    }

    /** Flushes and closes the sink. Records written afterwards are dropped. */
    public void stop() {
        loggerContext.stop();
    }

    public boolean isStarted() {
        return loggerContext.isStarted();
    }

    /**
     * Hands control to the configured terminator. Sinks flush on every record,
     * so the fatal record is already written; the engine stays usable when the
     * terminator returns.
     */
    public void terminate() {
        config.getTerminator().terminate(1);
    }
}
