package io.github.hongjungwan.fieldlog.api.context;

import java.util.List;

/**
 * B3 트레이스 상관관계 키.
 *
 * <ul>
 *   <li>{@code X-B3-TraceId}: 요청 체인(Trace)의 고유 식별자</li>
 *   <li>{@code X-B3-SpanId}: 작업 단위(Span)의 고유 식별자</li>
 *   <li>{@code X-B3-ParentSpanId}: 상위 Span 식별자, Root Span은 비어 있음</li>
 *   <li>{@code X-Span-Name}: 작업 단위 이름</li>
 * </ul>
 */
public final class TraceKeys {

    public static final String TRACE_ID = "X-B3-TraceId";
    public static final String SPAN_ID = "X-B3-SpanId";
    public static final String PARENT_SPAN_ID = "X-B3-ParentSpanId";
    public static final String SPAN_NAME = "X-Span-Name";

    /** Extraction order of the correlation keys. */
    public static final List<String> ORDERED = List.of(TRACE_ID, SPAN_ID, PARENT_SPAN_ID, SPAN_NAME);

    /** Name of the structured field carrying the extracted keys. */
    public static final String CONTEXT_FIELD = "context";

    private TraceKeys() {}
}
