package io.github.hongjungwan.fieldlog.core.internal;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import io.github.hongjungwan.fieldlog.api.config.LogLevel;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.List;

/**
 * LogLevel과 Logback Level 간 매핑. PANIC/FATAL은 ERROR + Marker로 표현.
 */
public final class RecordLevels {

    public static final Marker PANIC = MarkerFactory.getMarker("PANIC");
    public static final Marker FATAL = MarkerFactory.getMarker("FATAL");

    private RecordLevels() {}

    public static Level toLogback(LogLevel level) {
        return switch (level) {
            case DEBUG -> Level.DEBUG;
            case INFO -> Level.INFO;
            case WARN -> Level.WARN;
            case ERROR, PANIC, FATAL -> Level.ERROR;
        };
    }

    public static Marker markerFor(LogLevel level) {
        return switch (level) {
            case PANIC -> PANIC;
            case FATAL -> FATAL;
            default -> null;
        };
    }

    /** 이벤트의 실제 레벨 복원 */
    public static LogLevel levelOf(ILoggingEvent event) {
        List<Marker> markers = event.getMarkerList();
        if (markers != null) {
            for (Marker marker : markers) {
                if (marker.contains(FATAL)) {
                    return LogLevel.FATAL;
                }
                if (marker.contains(PANIC)) {
                    return LogLevel.PANIC;
                }
            }
        }

        int level = event.getLevel().toInt();
        if (level >= Level.ERROR_INT) {
            return LogLevel.ERROR;
        }
        if (level >= Level.WARN_INT) {
            return LogLevel.WARN;
        }
        if (level >= Level.INFO_INT) {
            return LogLevel.INFO;
        }
        return LogLevel.DEBUG;
    }
}
