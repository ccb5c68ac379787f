package io.github.hongjungwan.fieldlog.api.config;

import java.util.Locale;

/**
 * 로그 레벨. DEBUG~ERROR는 설정 가능한 임계 레벨, PANIC/FATAL은 출력 전용 레벨.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR,
    PANIC,
    FATAL;

    /**
     * Case-insensitive lookup of a configurable threshold level.
     * Anything outside DEBUG, INFO, WARN and ERROR (null and padded values included)
     * resolves to DEBUG.
     */
    public static LogLevel parse(String level) {
        if (level == null) {
            return DEBUG;
        }
        return switch (level.toUpperCase(Locale.ROOT)) {
            case "INFO" -> INFO;
            case "WARN" -> WARN;
            case "ERROR" -> ERROR;
            default -> DEBUG;
        };
    }

    /** 레코드에 기록되는 소문자 레벨명 */
    public String recordName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAtLeast(LogLevel other) {
        return ordinal() >= other.ordinal();
    }
}
