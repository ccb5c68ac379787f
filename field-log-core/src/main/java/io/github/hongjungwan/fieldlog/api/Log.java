package io.github.hongjungwan.fieldlog.api;

import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import io.github.hongjungwan.fieldlog.api.context.RequestContext;
import io.github.hongjungwan.fieldlog.api.field.Field;

/**
 * 프로세스 전역 LogFacade에 대한 정적 진입점.
 *
 * <pre>{@code
 * import static io.github.hongjungwan.fieldlog.api.field.Fields.*;
 *
 * Log.initialize(false, "", "info");
 * Log.info("order placed", string("orderId", id), integer("items", 3));
 * Log.withContext(requestContext).warn("retrying payment", duration("backoff", backoff));
 * }</pre>
 */
public final class Log {

    private static final LogFacade FACADE = new LogFacade();

    private Log() {}

    /** 전역 Facade. DI 컨테이너에 등록할 때 사용. */
    public static LogFacade facade() {
        return FACADE;
    }

    /** @see LogFacade#initialize(boolean, String, String, String...) */
    public static void initialize(boolean saveToFile, String filePath, String level, String... encoding) {
        FACADE.initialize(saveToFile, filePath, level, encoding);
    }

    public static void initialize(LogConfig config) {
        FACADE.initialize(config);
    }

    public static StructuredLogger getLogger(int callerSkip) {
        return FACADE.getLogger(callerSkip);
    }

    public static StructuredLogger withContext(RequestContext context) {
        return FACADE.withContext(context);
    }

    /** 현재 스레드에 바인딩된 RequestContext 사용 */
    public static StructuredLogger withContext() {
        return FACADE.withContext(RequestContext.current());
    }

    public static StructuredLogger withFields(Field... fields) {
        return FACADE.withFields(fields);
    }

    public static void debug(String message, Field... fields) {
        FACADE.debug(message, fields);
    }

    public static void info(String message, Field... fields) {
        FACADE.info(message, fields);
    }

    public static void warn(String message, Field... fields) {
        FACADE.warn(message, fields);
    }

    public static void error(String message, Field... fields) {
        FACADE.error(message, fields);
    }

    public static void panic(String message, Field... fields) {
        FACADE.panic(message, fields);
    }

    public static void fatal(String message, Field... fields) {
        FACADE.fatal(message, fields);
    }

    public static void debugf(String format, Object... args) {
        FACADE.debugf(format, args);
    }

    public static void infof(String format, Object... args) {
        FACADE.infof(format, args);
    }

    public static void warnf(String format, Object... args) {
        FACADE.warnf(format, args);
    }

    public static void errorf(String format, Object... args) {
        FACADE.errorf(format, args);
    }

    public static void panicf(String format, Object... args) {
        FACADE.panicf(format, args);
    }

    public static void fatalf(String format, Object... args) {
        FACADE.fatalf(format, args);
    }
}
