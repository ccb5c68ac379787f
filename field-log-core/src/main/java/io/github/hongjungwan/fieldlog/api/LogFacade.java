package io.github.hongjungwan.fieldlog.api;

import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import io.github.hongjungwan.fieldlog.api.context.RequestContext;
import io.github.hongjungwan.fieldlog.api.context.TraceKeys;
import io.github.hongjungwan.fieldlog.api.field.Field;
import io.github.hongjungwan.fieldlog.api.field.Fields;
import io.github.hongjungwan.fieldlog.core.context.TraceContextExtractor;
import io.github.hongjungwan.fieldlog.core.internal.DefaultStructuredLogger;
import io.github.hongjungwan.fieldlog.core.internal.LogEngine;
import io.github.hongjungwan.fieldlog.core.internal.LogEngineFactory;
import io.github.hongjungwan.fieldlog.spi.ProcessTerminator;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 로깅 엔진 1개를 소유하는 Facade. 첫 사용 시 기본 설정(console, DEBUG)으로 지연 초기화.
 *
 * <p>An instance can be created and injected like any other service; {@link Log}
 * holds the process-wide one. Explicit {@link #initialize(LogConfig)} calls always
 * replace the active engine (last call wins); the lazy default is built at most
 * once, under a lock, and only while no engine exists.</p>
 */
@Slf4j
public class LogFacade implements AutoCloseable {

    private final LogConfig defaultConfig;
    private final ProcessTerminator initFailureTerminator;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile LogEngine engine;

    public LogFacade() {
        this(LogConfig.defaultConfig(), ProcessTerminator.SYSTEM_EXIT);
    }

    /**
     * @param defaultConfig         configuration used on first use without prior initialization
     * @param initFailureTerminator invoked when that lazy initialization fails
     */
    public LogFacade(LogConfig defaultConfig, ProcessTerminator initFailureTerminator) {
        this.defaultConfig = defaultConfig;
        this.initFailureTerminator = initFailureTerminator;
    }

    /**
     * Initialize from raw options.
     *
     * <pre>{@code
     * facade.initialize(false, "", "debug");          // console lines
     * facade.initialize(false, "", "debug", "json");  // JSON to stdout
     * facade.initialize(true, "out.log", "debug");    // JSON to file
     * }</pre>
     *
     * @param saveToFile true to write to {@code filePath}, false for the console
     * @param filePath   log file, {@value LogConfig#DEFAULT_FILE_PATH} when empty
     * @param level      DEBUG, INFO, WARN or ERROR (any case), anything else is DEBUG
     * @param encoding   optional, {@code "json"} for JSON console output
     * @throws LogConfigException if the engine cannot be built
     */
    public void initialize(boolean saveToFile, String filePath, String level, String... encoding) {
        initialize(LogConfig.resolve(saveToFile, filePath, level, encoding));
    }

    /**
     * Builds a new engine and makes it the active one. The previous engine is
     * stopped; on failure it stays active.
     *
     * @throws LogConfigException if the engine cannot be built
     */
    public void initialize(LogConfig config) {
        LogEngine built = LogEngineFactory.build(config);

        LogEngine previous;
        lock.lock();
        try {
            previous = engine;
            engine = built;
        } finally {
            lock.unlock();
        }

        if (previous != null) {
            previous.stop();
            log.debug("Replaced active log engine");
        }

        new DefaultStructuredLogger(built).infof("initialize logger finish, base config is %s", config.describe());
    }

    /**
     * Logger whose caller location skips {@code callerSkip} frames beyond the
     * first frame outside the facade. Initializes the default configuration on
     * first use.
     */
    public StructuredLogger getLogger(int callerSkip) {
        return new DefaultStructuredLogger(activeEngine()).withCallerSkip(callerSkip);
    }

    public StructuredLogger getLogger() {
        return getLogger(0);
    }

    /**
     * Logger pre-bound with a {@code context} field holding the trace keys found in
     * {@code context}. Without any of them the plain logger is returned.
     */
    public StructuredLogger withContext(RequestContext context) {
        Map<String, Object> trace = TraceContextExtractor.getInstance().extract(context);
        StructuredLogger logger = getLogger(0);
        if (trace.isEmpty()) {
            return logger;
        }
        return logger.with(Fields.any(TraceKeys.CONTEXT_FIELD, trace));
    }

    public StructuredLogger withFields(Field... fields) {
        return getLogger(0).with(fields);
    }

    public void debug(String message, Field... fields) {
        getLogger(0).debug(message, fields);
    }

    public void info(String message, Field... fields) {
        getLogger(0).info(message, fields);
    }

    public void warn(String message, Field... fields) {
        getLogger(0).warn(message, fields);
    }

    public void error(String message, Field... fields) {
        getLogger(0).error(message, fields);
    }

    public void panic(String message, Field... fields) {
        getLogger(0).panic(message, fields);
    }

    public void fatal(String message, Field... fields) {
        getLogger(0).fatal(message, fields);
    }

    public void debugf(String format, Object... args) {
        getLogger(0).debugf(format, args);
    }

    public void infof(String format, Object... args) {
        getLogger(0).infof(format, args);
    }

    public void warnf(String format, Object... args) {
        getLogger(0).warnf(format, args);
    }

    public void errorf(String format, Object... args) {
        getLogger(0).errorf(format, args);
    }

    public void panicf(String format, Object... args) {
        getLogger(0).panicf(format, args);
    }

    public void fatalf(String format, Object... args) {
        getLogger(0).fatalf(format, args);
    }

    public boolean isInitialized() {
        return engine != null;
    }

    /** 활성 엔진의 설정. 초기화 전이면 null. */
    public LogConfig getConfig() {
        LogEngine current = engine;
        return current != null ? current.getConfig() : null;
    }

    /** Stops the active engine; the next log call initializes the default again. */
    @Override
    public void close() {
        LogEngine previous;
        lock.lock();
        try {
            previous = engine;
            engine = null;
        } finally {
            lock.unlock();
        }
        if (previous != null) {
            previous.stop();
        }
    }

    private LogEngine activeEngine() {
        LogEngine current = engine;
        if (current != null) {
            return current;
        }

        lock.lock();
        try {
            if (engine == null) {
                initializeDefault();
            }
            return engine;
        } finally {
            lock.unlock();
        }
    }

    private void initializeDefault() {
        try {
            initialize(defaultConfig);
        } catch (LogConfigException e) {
            log.error("Failed to initialize default logger, terminating", e);
            initFailureTerminator.terminate(1);
            throw e;
        }
    }
}
