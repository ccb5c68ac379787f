package io.github.hongjungwan.fieldlog.core.context;

import io.github.hongjungwan.fieldlog.api.context.RequestContext;
import io.github.hongjungwan.fieldlog.api.context.TraceKeys;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads trace-correlation values out of a {@link RequestContext}.
 *
 * Keys are read in a fixed order and absent keys are left out; extraction
 * never fails and a null context yields an empty map.
 */
public final class TraceContextExtractor {

    private static final TraceContextExtractor INSTANCE = new TraceContextExtractor(TraceKeys.ORDERED);

    private final List<String> keys;

    public TraceContextExtractor(List<String> keys) {
        this.keys = List.copyOf(keys);
    }

    public static TraceContextExtractor getInstance() {
        return INSTANCE;
    }

    public Map<String, Object> extract(RequestContext context) {
        if (context == null || context.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> found = new LinkedHashMap<>();
        for (String key : keys) {
            Object value = context.value(key);
            if (value != null) {
                found.put(key, value);
            }
        }
        return found.isEmpty() ? Map.of() : Collections.unmodifiableMap(found);
    }

    public List<String> getKeys() {
        return keys;
    }
}
