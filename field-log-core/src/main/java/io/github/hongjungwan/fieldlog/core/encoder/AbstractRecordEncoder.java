package io.github.hongjungwan.fieldlog.core.encoder;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.encoder.EncoderBase;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.hongjungwan.fieldlog.api.config.LogLevel;
import io.github.hongjungwan.fieldlog.api.field.Field;
import io.github.hongjungwan.fieldlog.api.field.Fields;
import io.github.hongjungwan.fieldlog.core.internal.RecordLevels;
import org.slf4j.event.KeyValuePair;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON/Console 인코더 공통 부분. 레벨, 타임스탬프, caller, 필드, 스택 추출.
 */
public abstract class AbstractRecordEncoder extends EncoderBase<ILoggingEvent> {

    protected static final byte[] EMPTY = new byte[0];
    protected static final String LINE_SEPARATOR = "\n";

    protected final DateTimeFormatter timeFormatter;
    protected final FieldJsonWriter fieldWriter;
    private final LogLevel stacktraceLevel;

    protected AbstractRecordEncoder(DateTimeFormatter timeFormatter, LogLevel stacktraceLevel) {
        this.timeFormatter = timeFormatter;
        this.stacktraceLevel = stacktraceLevel;
        this.fieldWriter = new FieldJsonWriter(timeFormatter);
    }

    @Override
    public byte[] headerBytes() {
        return EMPTY;
    }

    @Override
    public byte[] footerBytes() {
        return EMPTY;
    }

    @Override
    public byte[] encode(ILoggingEvent event) {
        try {
            return (render(event) + LINE_SEPARATOR).getBytes(StandardCharsets.UTF_8);
        } catch (Exception e) {
            addError("Failed to encode log record", e);
            return fallback(event, e).getBytes(StandardCharsets.UTF_8);
        }
    }

    protected abstract String render(ILoggingEvent event) throws Exception;

    private String fallback(ILoggingEvent event, Exception cause) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("level", levelName(event));
        node.put("ts", timestamp(event));
        node.put("msg", message(event));
        node.put("encodeError", FieldJsonWriter.errorMessage(cause));
        return node + LINE_SEPARATOR;
    }

    protected String levelName(ILoggingEvent event) {
        return RecordLevels.levelOf(event).recordName();
    }

    protected String timestamp(ILoggingEvent event) {
        return timeFormatter.format(Instant.ofEpochMilli(event.getTimeStamp()));
    }

    protected String message(ILoggingEvent event) {
        String message = event.getFormattedMessage();
        return message != null ? message : "";
    }

    /** "File.java:line" 형식, caller 정보가 없으면 null */
    protected String caller(ILoggingEvent event) {
        StackTraceElement[] callerData = event.getCallerData();
        if (callerData == null || callerData.length == 0) {
            return null;
        }
        StackTraceElement frame = callerData[0];
        String file = frame.getFileName() != null ? frame.getFileName() : frame.getClassName();
        return file + ":" + frame.getLineNumber();
    }

    /** 설정 레벨 이상일 때만 스택 반환, 아니면 null */
    protected String stacktrace(ILoggingEvent event) {
        if (!RecordLevels.levelOf(event).isAtLeast(stacktraceLevel)) {
            return null;
        }
        StackTraceElement[] callerData = event.getCallerData();
        if (callerData == null || callerData.length == 0) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (StackTraceElement frame : callerData) {
            if (sb.length() > 0) {
                sb.append(LINE_SEPARATOR);
            }
            sb.append("\tat ").append(frame);
        }
        return sb.toString();
    }

    protected List<Field> fields(ILoggingEvent event) {
        List<KeyValuePair> pairs = event.getKeyValuePairs();
        if (pairs == null || pairs.isEmpty()) {
            return List.of();
        }
        List<Field> fields = new ArrayList<>(pairs.size());
        for (KeyValuePair pair : pairs) {
            if (pair.value instanceof Field field) {
                fields.add(field);
            } else {
                fields.add(Fields.any(pair.key, pair.value));
            }
        }
        return fields;
    }

    protected ObjectNode fieldNode(ILoggingEvent event) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        fieldWriter.writeFields(node, fields(event));
        return node;
    }
}
