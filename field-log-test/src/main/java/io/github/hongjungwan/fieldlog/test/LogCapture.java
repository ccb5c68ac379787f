package io.github.hongjungwan.fieldlog.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hongjungwan.fieldlog.api.LogFacade;
import io.github.hongjungwan.fieldlog.api.config.Encoding;
import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import io.github.hongjungwan.fieldlog.api.config.LogLevel;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * LogFacade 출력을 메모리에 JSON으로 캡처하는 TestKit.
 *
 * <pre>{@code
 * try (LogCapture capture = LogCapture.start(Log.facade())) {
 *     service.placeOrder(order);
 *     assertThatLog(capture.last()).hasLevel("info").hasFieldValue("orderId", "o-1");
 * }
 * }</pre>
 *
 * Fatal records do not end the process; the requested exit status is
 * recorded in {@link #getTerminations()} instead.
 */
public class LogCapture implements AutoCloseable {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final LogFacade facade;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final List<Integer> terminations = new CopyOnWriteArrayList<>();

    private LogCapture(LogFacade facade) {
        this.facade = facade;
    }

    /** DEBUG 레벨로 캡처 시작 */
    public static LogCapture start(LogFacade facade) {
        return start(facade, LogLevel.DEBUG);
    }

    public static LogCapture start(LogFacade facade, LogLevel level) {
        LogCapture capture = new LogCapture(facade);
        facade.initialize(LogConfig.builder()
                .encoding(Encoding.JSON)
                .level(level)
                .output(capture.buffer)
                .terminator(capture.terminations::add)
                .build());
        // 초기화 요약 레코드 제외
        capture.clear();
        return capture;
    }

    /** 캡처된 레코드 전체 (기록 순서) */
    public List<CapturedRecord> records() {
        String text = buffer.toString(StandardCharsets.UTF_8);
        List<CapturedRecord> records = new ArrayList<>();
        for (String line : text.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(new CapturedRecord(MAPPER.readTree(line)));
            } catch (IOException e) {
                throw new UncheckedIOException("Captured line is not a JSON record: " + line, e);
            }
        }
        return Collections.unmodifiableList(records);
    }

    /** 마지막 레코드 */
    public CapturedRecord last() {
        List<CapturedRecord> records = records();
        if (records.isEmpty()) {
            throw new AssertionError("No log record captured");
        }
        return records.get(records.size() - 1);
    }

    public List<Integer> getTerminations() {
        return Collections.unmodifiableList(terminations);
    }

    public void clear() {
        buffer.reset();
    }

    /** Stops the capturing engine; the facade falls back to its default on next use. */
    @Override
    public void close() {
        facade.close();
    }
}
