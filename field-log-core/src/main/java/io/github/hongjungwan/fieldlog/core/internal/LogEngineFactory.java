package io.github.hongjungwan.fieldlog.core.internal;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.util.LogbackMDCAdapter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.status.Status;
import io.github.hongjungwan.fieldlog.api.LogConfigException;
import io.github.hongjungwan.fieldlog.api.config.Encoding;
import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import io.github.hongjungwan.fieldlog.core.encoder.ConsoleRecordEncoder;
import io.github.hongjungwan.fieldlog.core.encoder.JsonRecordEncoder;
import io.github.hongjungwan.fieldlog.core.encoder.TimestampFormats;
import lombok.extern.slf4j.Slf4j;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * LogConfig로부터 전용 Logback LoggerContext를 조립. 호스트 애플리케이션의 logback 설정과 분리됨.
 */
@Slf4j
public final class LogEngineFactory {

    public static final String LOGGER_NAME = "field-log";
    static final String APPENDER_NAME = "field-log-sink";

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private LogEngineFactory() {}

    /**
     * Builds and starts a new engine.
     *
     * @throws LogConfigException if the encoder or the sink cannot be started
     */
    public static LogEngine build(LogConfig config) {
        if (config == null) {
            throw new LogConfigException("LogConfig must not be null");
        }

        LoggerContext context = new LoggerContext();
        context.setName(LOGGER_NAME + "-" + SEQUENCE.incrementAndGet());
        // LoggingEvent 준비 단계가 MDC adapter를 참조하므로 start 전에 지정
        context.setMDCAdapter(new LogbackMDCAdapter());
        context.start();

        try {
            Encoder<ILoggingEvent> encoder = createEncoder(config);
            encoder.setContext(context);
            encoder.start();

            OutputStreamAppender<ILoggingEvent> appender = createAppender(config, encoder);
            appender.setContext(context);
            appender.setName(APPENDER_NAME);
            appender.start();

            if (!appender.isStarted()) {
                throw new LogConfigException("Failed to start log sink (" + describeSink(config) + "): "
                        + collectErrors(context));
            }

            Logger logger = context.getLogger(LOGGER_NAME);
            logger.setAdditive(false);
            logger.setLevel(RecordLevels.toLogback(config.getLevel()));
            logger.addAppender(appender);

            log.debug("Built log engine {} with {}", context.getName(), config.describe());
            return new LogEngine(config, context, logger);

        } catch (LogConfigException e) {
            context.stop();
            throw e;
        } catch (RuntimeException e) {
            context.stop();
            throw new LogConfigException("Failed to build log engine (" + describeSink(config) + ")", e);
        }
    }

    private static Encoder<ILoggingEvent> createEncoder(LogConfig config) {
        DateTimeFormatter timeFormatter = TimestampFormats.forConfig(config);
        if (config.getEncoding() == Encoding.JSON) {
            return new JsonRecordEncoder(timeFormatter, config.getStacktraceLevel());
        }
        return new ConsoleRecordEncoder(timeFormatter, config.getStacktraceLevel());
    }

    private static OutputStreamAppender<ILoggingEvent> createAppender(LogConfig config, Encoder<ILoggingEvent> encoder) {
        if (config.isSaveToFile()) {
            FileAppender<ILoggingEvent> appender = new FileAppender<>();
            appender.setFile(config.getFilePath());
            appender.setAppend(true);
            appender.setEncoder(encoder);
            return appender;
        }

        if (config.getOutput() != null) {
            OutputStreamAppender<ILoggingEvent> appender = new OutputStreamAppender<>();
            appender.setEncoder(encoder);
            appender.setOutputStream(new NonClosingOutputStream(config.getOutput()));
            return appender;
        }

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setEncoder(encoder);
        return appender;
    }

    private static String describeSink(LogConfig config) {
        return config.isSaveToFile() ? "file " + config.getFilePath() : "console";
    }

    private static String collectErrors(LoggerContext context) {
        String errors = context.getStatusManager().getCopyOfStatusList().stream()
                .filter(status -> status.getLevel() == Status.ERROR)
                .map(LogEngineFactory::describeStatus)
                .collect(Collectors.joining("; "));
        return errors.isEmpty() ? "unknown error" : errors;
    }

    private static String describeStatus(Status status) {
        Throwable cause = status.getThrowable();
        return cause == null ? status.getMessage() : status.getMessage() + " " + cause.getMessage();
    }

    /** 호출자가 소유한 스트림은 엔진 교체 시 닫지 않는다 */
    private static final class NonClosingOutputStream extends FilterOutputStream {

        NonClosingOutputStream(OutputStream out) {
            super(out);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}
