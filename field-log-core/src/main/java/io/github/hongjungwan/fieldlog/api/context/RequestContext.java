package io.github.hongjungwan.fieldlog.api.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * 요청 범위의 불변 key/value Context. {@link #with(String, Object)}로 파생하고,
 * 필요하면 {@link #makeCurrent()}로 현재 스레드에 바인딩한다.
 *
 * <p>The logging facade only reads the {@link TraceKeys} from it; populating
 * them is up to the host application (typically from inbound request headers).</p>
 */
public final class RequestContext {

    private static final RequestContext EMPTY = new RequestContext(Map.of());

    private static final ThreadLocal<RequestContext> CURRENT = new ThreadLocal<>();

    private final Map<String, Object> values;

    private RequestContext(Map<String, Object> values) {
        this.values = values;
    }

    public static RequestContext empty() {
        return EMPTY;
    }

    public static RequestContext of(String key, Object value) {
        return EMPTY.with(key, value);
    }

    /** 현재 스레드에 바인딩된 Context. 없으면 null. */
    public static RequestContext current() {
        return CURRENT.get();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** key/value를 추가한 새 Context 반환. 기존 key는 덮어쓴다. */
    public RequestContext with(String key, Object value) {
        Objects.requireNonNull(key, "key");
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new RequestContext(Collections.unmodifiableMap(copy));
    }

    /** key에 연결된 값. 없으면 null. */
    public Object value(String key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /** ThreadLocal에 설정. 반환된 Scope close 시 이전 Context 복원. */
    public Scope makeCurrent() {
        RequestContext previous = CURRENT.get();
        CURRENT.set(this);
        return () -> {
            if (previous == null) {
                CURRENT.remove();
            } else {
                CURRENT.set(previous);
            }
        };
    }

    /** Runnable 래핑. 실행 시 이 Context 활성화. */
    public Runnable wrap(Runnable runnable) {
        return () -> {
            try (Scope ignored = this.makeCurrent()) {
                runnable.run();
            }
        };
    }

    /** Callable 래핑. 실행 시 이 Context 활성화. */
    public <T> Callable<T> wrap(Callable<T> callable) {
        return () -> {
            try (Scope ignored = this.makeCurrent()) {
                return callable.call();
            }
        };
    }

    @Override
    public String toString() {
        return "RequestContext" + values;
    }

    /** Context 스코프 관리 (AutoCloseable) */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    /** 불변 RequestContext 빌더 */
    public static class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        public Builder traceId(String traceId) {
            return put(TraceKeys.TRACE_ID, traceId);
        }

        public Builder spanId(String spanId) {
            return put(TraceKeys.SPAN_ID, spanId);
        }

        public Builder parentSpanId(String parentSpanId) {
            return put(TraceKeys.PARENT_SPAN_ID, parentSpanId);
        }

        public Builder spanName(String spanName) {
            return put(TraceKeys.SPAN_NAME, spanName);
        }

        /** null 값은 무시 */
        public Builder put(String key, Object value) {
            if (value != null) {
                values.put(key, value);
            }
            return this;
        }

        public RequestContext build() {
            return values.isEmpty() ? EMPTY : new RequestContext(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
