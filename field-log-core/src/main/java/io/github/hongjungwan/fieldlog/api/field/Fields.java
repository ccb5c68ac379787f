package io.github.hongjungwan.fieldlog.api.field;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 타입별 {@link Field} 생성자. 검증은 하지 않는다.
 */
public final class Fields {

    public static final String ERROR_KEY = "error";

    private static final Field SKIP = new Field("", FieldType.SKIP, null);

    private Fields() {}

    public static Field integer(String key, int value) {
        return new Field(key, FieldType.INT64, (long) value);
    }

    public static Field int64(String key, long value) {
        return new Field(key, FieldType.INT64, value);
    }

    /** The value is read as an unsigned 32-bit integer. */
    public static Field uint(String key, int value) {
        return new Field(key, FieldType.UINT64, Integer.toUnsignedLong(value));
    }

    /** The value is read as an unsigned 64-bit integer. */
    public static Field uint64(String key, long value) {
        return new Field(key, FieldType.UINT64, value);
    }

    public static Field uintptr(String key, long value) {
        return new Field(key, FieldType.UINTPTR, value);
    }

    public static Field float64(String key, double value) {
        return new Field(key, FieldType.FLOAT64, value);
    }

    public static Field bool(String key, boolean value) {
        return new Field(key, FieldType.BOOL, value);
    }

    public static Field string(String key, String value) {
        return new Field(key, FieldType.STRING, value);
    }

    /** Rendered lazily with {@code toString()}; a null value renders as {@code <nil>}. */
    public static Field stringer(String key, Object value) {
        return new Field(key, FieldType.STRINGER, value);
    }

    public static Field time(String key, Instant value) {
        return new Field(key, FieldType.TIME, value);
    }

    public static Field duration(String key, Duration value) {
        return new Field(key, FieldType.DURATION, value);
    }

    /** Keyless error field stored under {@value #ERROR_KEY}; a null error is omitted. */
    public static Field error(Throwable error) {
        return namedError(ERROR_KEY, error);
    }

    public static Field namedError(String key, Throwable error) {
        if (error == null) {
            return SKIP;
        }
        return new Field(key, FieldType.ERROR, error);
    }

    /** Field that is left out of the record. */
    public static Field skip() {
        return SKIP;
    }

    /**
     * 임의 타입 필드. 호출 시점에 구체 타입으로 분류하고,
     * 알려진 타입이 아니면 리플렉션 JSON 인코더에 위임한다.
     */
    public static Field any(String key, Object value) {
        if (value == null) {
            return new Field(key, FieldType.REFLECTED, null);
        }
        if (value instanceof Field field) {
            return new Field(key, field.getType(), field.getValue());
        }
        if (value instanceof Loggable) {
            return new Field(key, FieldType.OBJECT, value);
        }
        if (value instanceof String str) {
            return string(key, str);
        }
        if (value instanceof Boolean bool) {
            return bool(key, bool);
        }
        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            return int64(key, ((Number) value).longValue());
        }
        if (value instanceof Float f) {
            // float32 정밀도 유지: 0.1f -> 0.1
            return float64(key, Double.parseDouble(Float.toString(f)));
        }
        if (value instanceof Double d) {
            return float64(key, d);
        }
        if (value instanceof BigInteger || value instanceof BigDecimal) {
            return new Field(key, FieldType.REFLECTED, value);
        }
        if (value instanceof Instant instant) {
            return time(key, instant);
        }
        if (value instanceof Duration duration) {
            return duration(key, duration);
        }
        if (value instanceof Throwable error) {
            return namedError(key, error);
        }
        if (value instanceof Map<?, ?> map) {
            return new Field(key, FieldType.MAP, Collections.unmodifiableMap(new LinkedHashMap<>(map)));
        }
        if (value instanceof Collection<?> collection) {
            return new Field(key, FieldType.ARRAY, Collections.unmodifiableList(new ArrayList<>(collection)));
        }
        if (value.getClass().isArray()) {
            return new Field(key, FieldType.ARRAY, arrayToList(value));
        }
        if (value instanceof Enum<?> constant) {
            return string(key, constant.name());
        }
        if (value instanceof CharSequence chars) {
            return string(key, chars.toString());
        }
        return new Field(key, FieldType.REFLECTED, value);
    }

    private static List<Object> arrayToList(Object array) {
        int length = Array.getLength(array);
        List<Object> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(Array.get(array, i));
        }
        return Collections.unmodifiableList(elements);
    }
}
