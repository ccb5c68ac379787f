package io.github.hongjungwan.fieldlog.core.encoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.hongjungwan.fieldlog.api.field.Field;
import io.github.hongjungwan.fieldlog.api.field.Fields;
import io.github.hongjungwan.fieldlog.api.field.Loggable;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 타입별 Field 값을 JSON 노드로 변환. 알 수 없는 타입은 Jackson 리플렉션 직렬화.
 *
 * <p>Conventions: unsigned values are written as unsigned decimals, non-finite
 * floats as {@code "NaN"}, {@code "+Inf"} and {@code "-Inf"}, durations as float
 * seconds, times with the sink's timestamp pattern and errors as their message.
 * A value that cannot be rendered is written under {@code <key>Error}.</p>
 */
public class FieldJsonWriter {

    static final String NIL = "<nil>";
    private static final int MAX_DEPTH = 32;

    private final ObjectMapper objectMapper;
    private final DateTimeFormatter timeFormatter;
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public FieldJsonWriter(DateTimeFormatter timeFormatter) {
        this.timeFormatter = timeFormatter;
        this.objectMapper = createObjectMapper();
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        return mapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /** 필드 목록을 target 노드에 순서대로 기록 */
    public void writeFields(ObjectNode target, List<Field> fields) {
        for (Field field : fields) {
            writeField(target, field);
        }
    }

    public void writeField(ObjectNode target, Field field) {
        if (field == null || field.isSkipped()) {
            return;
        }
        try {
            target.set(field.getKey(), toNode(field, 0));
        } catch (RuntimeException e) {
            target.put(field.getKey() + "Error", describe(e));
        }
    }

    JsonNode toNode(Field field, int depth) {
        if (depth > MAX_DEPTH) {
            throw new IllegalStateException("value nesting exceeds " + MAX_DEPTH + " levels");
        }

        Object value = field.getValue();
        return switch (field.getType()) {
            case INT64 -> nodes.numberNode((Long) value);
            case UINT64, UINTPTR -> unsigned((Long) value);
            case FLOAT64 -> floatNode((Double) value);
            case BOOL -> nodes.booleanNode((Boolean) value);
            case STRING -> value == null ? nodes.nullNode() : nodes.textNode((String) value);
            case STRINGER -> nodes.textNode(value == null ? NIL : value.toString());
            case TIME -> value == null ? nodes.nullNode() : nodes.textNode(timeFormatter.format((Instant) value));
            case DURATION -> value == null ? nodes.nullNode() : durationNode((Duration) value);
            case ERROR -> nodes.textNode(errorMessage((Throwable) value));
            case OBJECT -> resolve(((Loggable) value).toLogValue(), depth + 1);
            case ARRAY -> arrayNode((Collection<?>) value, depth);
            case MAP -> objectNode((Map<?, ?>) value, depth);
            case REFLECTED -> value == null ? nodes.nullNode() : reflect(value);
            case SKIP -> nodes.nullNode();
        };
    }

    private JsonNode resolve(Object value, int depth) {
        return toNode(Fields.any("", value), depth);
    }

    private ArrayNode arrayNode(Collection<?> elements, int depth) {
        ArrayNode array = nodes.arrayNode();
        for (Object element : elements) {
            array.add(resolve(element, depth + 1));
        }
        return array;
    }

    private ObjectNode objectNode(Map<?, ?> entries, int depth) {
        ObjectNode object = nodes.objectNode();
        entries.forEach((k, v) -> object.set(String.valueOf(k), resolve(v, depth + 1)));
        return object;
    }

    private JsonNode reflect(Object value) {
        return objectMapper.valueToTree(value);
    }

    private JsonNode unsigned(long raw) {
        if (raw >= 0) {
            return nodes.numberNode(raw);
        }
        return nodes.numberNode(new BigInteger(Long.toUnsignedString(raw)));
    }

    private JsonNode floatNode(double value) {
        if (Double.isNaN(value)) {
            return nodes.textNode("NaN");
        }
        if (Double.isInfinite(value)) {
            return nodes.textNode(value > 0 ? "+Inf" : "-Inf");
        }
        return nodes.numberNode(value);
    }

    private JsonNode durationNode(Duration duration) {
        return nodes.numberNode(duration.getSeconds() + duration.getNano() / 1_000_000_000d);
    }

    static String errorMessage(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.toString();
    }

    private static String describe(RuntimeException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return errorMessage(cause);
    }
}
