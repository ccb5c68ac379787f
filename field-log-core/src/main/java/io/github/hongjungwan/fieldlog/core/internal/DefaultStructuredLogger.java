package io.github.hongjungwan.fieldlog.core.internal;

import io.github.hongjungwan.fieldlog.api.Log;
import io.github.hongjungwan.fieldlog.api.LogFacade;
import io.github.hongjungwan.fieldlog.api.LogPanicException;
import io.github.hongjungwan.fieldlog.api.StructuredLogger;
import io.github.hongjungwan.fieldlog.api.config.LogLevel;
import io.github.hongjungwan.fieldlog.api.field.Field;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * LogEngine 기반 StructuredLogger 구현. 바인딩 필드와 caller-skip만 보유하는 가벼운 뷰.
 */
public class DefaultStructuredLogger implements StructuredLogger {

    private static final Field[] NO_FIELDS = new Field[0];

    private static final CallerLocator CALLER_LOCATOR = new CallerLocator(Set.of(
            DefaultStructuredLogger.class.getName(),
            LogFacade.class.getName(),
            Log.class.getName()));

    private final LogEngine engine;
    private final List<Field> boundFields;
    private final int callerSkip;

    public DefaultStructuredLogger(LogEngine engine) {
        this(engine, List.of(), 0);
    }

    private DefaultStructuredLogger(LogEngine engine, List<Field> boundFields, int callerSkip) {
        this.engine = engine;
        this.boundFields = boundFields;
        this.callerSkip = callerSkip;
    }

    @Override
    public void debug(String message, Field... fields) {
        emit(LogLevel.DEBUG, message, fields);
    }

    @Override
    public void info(String message, Field... fields) {
        emit(LogLevel.INFO, message, fields);
    }

    @Override
    public void warn(String message, Field... fields) {
        emit(LogLevel.WARN, message, fields);
    }

    @Override
    public void error(String message, Field... fields) {
        emit(LogLevel.ERROR, message, fields);
    }

    @Override
    public void panic(String message, Field... fields) {
        emit(LogLevel.PANIC, message, fields);
        throw new LogPanicException(message);
    }

    @Override
    public void fatal(String message, Field... fields) {
        emit(LogLevel.FATAL, message, fields);
        engine.terminate();
    }

    @Override
    public void debugf(String format, Object... args) {
        emit(LogLevel.DEBUG, String.format(format, args), NO_FIELDS);
    }

    @Override
    public void infof(String format, Object... args) {
        emit(LogLevel.INFO, String.format(format, args), NO_FIELDS);
    }

    @Override
    public void warnf(String format, Object... args) {
        emit(LogLevel.WARN, String.format(format, args), NO_FIELDS);
    }

    @Override
    public void errorf(String format, Object... args) {
        emit(LogLevel.ERROR, String.format(format, args), NO_FIELDS);
    }

    @Override
    public void panicf(String format, Object... args) {
        panic(String.format(format, args));
    }

    @Override
    public void fatalf(String format, Object... args) {
        fatal(String.format(format, args));
    }

    @Override
    public StructuredLogger with(Field... fields) {
        if (fields == null || fields.length == 0) {
            return this;
        }
        List<Field> merged = new ArrayList<>(boundFields.size() + fields.length);
        merged.addAll(boundFields);
        for (Field field : fields) {
            if (field != null && !field.isSkipped()) {
                merged.add(field);
            }
        }
        return new DefaultStructuredLogger(engine, Collections.unmodifiableList(merged), callerSkip);
    }

    @Override
    public StructuredLogger withCallerSkip(int skip) {
        if (skip == 0) {
            return this;
        }
        return new DefaultStructuredLogger(engine, boundFields, Math.max(0, callerSkip + skip));
    }

    @Override
    public boolean isEnabled(LogLevel level) {
        return engine.isEnabled(level);
    }

    public LogEngine getEngine() {
        return engine;
    }

    public List<Field> getBoundFields() {
        return boundFields;
    }

    public int getCallerSkip() {
        return callerSkip;
    }

    private void emit(LogLevel level, String message, Field[] fields) {
        if (!engine.isEnabled(level)) {
            return;
        }

        StackTraceElement[] callerData = CALLER_LOCATOR.locate(new Throwable().getStackTrace(), callerSkip);
        engine.write(level, message, collect(fields), callerData);
    }

    private List<Field> collect(Field[] fields) {
        if (fields == null || fields.length == 0) {
            return boundFields;
        }
        List<Field> all = new ArrayList<>(boundFields.size() + fields.length);
        all.addAll(boundFields);
        for (Field field : fields) {
            if (field != null && !field.isSkipped()) {
                all.add(field);
            }
        }
        return all;
    }
}
