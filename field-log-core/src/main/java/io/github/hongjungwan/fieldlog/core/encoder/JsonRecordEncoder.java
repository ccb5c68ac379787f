package io.github.hongjungwan.fieldlog.core.encoder;

import ch.qos.logback.classic.spi.ILoggingEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hongjungwan.fieldlog.api.config.LogLevel;

import java.time.format.DateTimeFormatter;

/**
 * One JSON object per line:
 * {@code {"level":"info","ts":"...","caller":"Foo.java:12","msg":"...",<fields>,"stacktrace":"..."}}.
 */
public class JsonRecordEncoder extends AbstractRecordEncoder {

    public static final String LEVEL_KEY = "level";
    public static final String TIME_KEY = "ts";
    public static final String CALLER_KEY = "caller";
    public static final String MESSAGE_KEY = "msg";
    public static final String STACKTRACE_KEY = "stacktrace";

    private final ObjectMapper objectMapper;

    public JsonRecordEncoder(DateTimeFormatter timeFormatter, LogLevel stacktraceLevel) {
        super(timeFormatter, stacktraceLevel);
        this.objectMapper = fieldWriter.getObjectMapper();
    }

    @Override
    protected String render(ILoggingEvent event) throws Exception {
        ObjectNode record = objectMapper.createObjectNode();
        record.put(LEVEL_KEY, levelName(event));
        record.put(TIME_KEY, timestamp(event));

        String caller = caller(event);
        if (caller != null) {
            record.put(CALLER_KEY, caller);
        }
        record.put(MESSAGE_KEY, message(event));

        fieldWriter.writeFields(record, fields(event));

        String stacktrace = stacktrace(event);
        if (stacktrace != null) {
            record.put(STACKTRACE_KEY, stacktrace);
        }
        return objectMapper.writeValueAsString(record);
    }
}
