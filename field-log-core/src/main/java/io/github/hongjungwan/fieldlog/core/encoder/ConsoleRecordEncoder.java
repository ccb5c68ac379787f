package io.github.hongjungwan.fieldlog.core.encoder;

import ch.qos.logback.classic.spi.ILoggingEvent;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hongjungwan.fieldlog.api.config.LogLevel;

import java.time.format.DateTimeFormatter;

/**
 * 사람이 읽는 탭 구분 라인: {@code ts  level  caller  msg  {"key": "value"}}.
 * 스택은 다음 줄부터 출력.
 */
public class ConsoleRecordEncoder extends AbstractRecordEncoder {

    private static final char SEPARATOR = '\t';

    private final ObjectWriter fieldsWriter;

    public ConsoleRecordEncoder(DateTimeFormatter timeFormatter, LogLevel stacktraceLevel) {
        super(timeFormatter, stacktraceLevel);
        this.fieldsWriter = fieldWriter.getObjectMapper().writer(new SpacedJsonPrinter());
    }

    @Override
    protected String render(ILoggingEvent event) throws Exception {
        StringBuilder line = new StringBuilder(128)
                .append(timestamp(event))
                .append(SEPARATOR)
                .append(levelName(event));

        String caller = caller(event);
        if (caller != null) {
            line.append(SEPARATOR).append(caller);
        }
        line.append(SEPARATOR).append(message(event));

        ObjectNode fields = fieldNode(event);
        if (!fields.isEmpty()) {
            line.append(SEPARATOR).append(fieldsWriter.writeValueAsString(fields));
        }

        String stacktrace = stacktrace(event);
        if (stacktrace != null) {
            line.append(LINE_SEPARATOR).append(stacktrace);
        }
        return line.toString();
    }
}
