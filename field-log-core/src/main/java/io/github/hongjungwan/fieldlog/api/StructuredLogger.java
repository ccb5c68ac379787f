package io.github.hongjungwan.fieldlog.api;

import io.github.hongjungwan.fieldlog.api.config.LogLevel;
import io.github.hongjungwan.fieldlog.api.field.Field;

/**
 * 필드 기반 구조화 로거. 인스턴스는 불변이며 여러 스레드에서 동시에 사용 가능.
 */
public interface StructuredLogger {

    void debug(String message, Field... fields);

    void info(String message, Field... fields);

    void warn(String message, Field... fields);

    void error(String message, Field... fields);

    /**
     * Writes a panic-level record, then throws.
     *
     * @throws LogPanicException always, after the record is written
     */
    void panic(String message, Field... fields);

    /**
     * Writes a fatal-level record, flushes the sink and terminates the process
     * through the configured {@link io.github.hongjungwan.fieldlog.spi.ProcessTerminator}.
     */
    void fatal(String message, Field... fields);

    void debugf(String format, Object... args);

    void infof(String format, Object... args);

    void warnf(String format, Object... args);

    void errorf(String format, Object... args);

    void panicf(String format, Object... args);

    void fatalf(String format, Object... args);

    /** 필드가 미리 바인딩된 자식 로거. 바인딩 필드는 호출 필드보다 먼저 기록된다. */
    StructuredLogger with(Field... fields);

    /** caller 위치 계산 시 추가로 건너뛸 스택 프레임 수 (누적) */
    StructuredLogger withCallerSkip(int skip);

    boolean isEnabled(LogLevel level);

    default boolean isDebugEnabled() {
        return isEnabled(LogLevel.DEBUG);
    }

    default boolean isInfoEnabled() {
        return isEnabled(LogLevel.INFO);
    }
}
