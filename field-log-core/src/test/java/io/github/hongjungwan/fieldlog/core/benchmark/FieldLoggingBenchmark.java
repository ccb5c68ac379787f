package io.github.hongjungwan.fieldlog.core.benchmark;

import io.github.hongjungwan.fieldlog.api.LogFacade;
import io.github.hongjungwan.fieldlog.api.StructuredLogger;
import io.github.hongjungwan.fieldlog.api.config.Encoding;
import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import io.github.hongjungwan.fieldlog.api.context.RequestContext;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.OutputStream;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static io.github.hongjungwan.fieldlog.api.field.Fields.*;

/**
 * JMH Benchmark for field encoding through the full engine (JSON and console).
 *
 * Output goes to a discarding stream so only encoding cost is measured.
 */
@BenchmarkMode({Mode.Throughput, Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(value = 1, jvmArgs = {"-Xmx512m", "-Xms512m"})
public class FieldLoggingBenchmark {

    @Param({"json", "console"})
    private String encoding;

    private LogFacade facade;
    private StructuredLogger logger;
    private StructuredLogger contextLogger;
    private IllegalStateException failure;
    private Map<String, Object> payload;

    @Setup(Level.Trial)
    public void setup() {
        facade = new LogFacade();
        facade.initialize(LogConfig.builder()
                .encoding(Encoding.parse(encoding))
                .output(OutputStream.nullOutputStream())
                .build());
        logger = facade.getLogger();
        contextLogger = facade.withContext(RequestContext.builder()
                .traceId("0af7651916cd43dd8448eb211c80319c")
                .spanId("b7ad6b7169203331")
                .spanName("benchmark")
                .build());
        failure = new IllegalStateException("this is error");
        payload = Map.of("userId", "emp_1001", "region", "KR", "records", 1000);
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        facade.close();
    }

    @Benchmark
    public void stringField() {
        logger.info("this is info", string("key", "value"));
    }

    @Benchmark
    public void numericFields() {
        logger.info("this is info", integer("height", 170), float64("ratio", 0.75), duration("elapsed", Duration.ofMillis(1500)));
    }

    @Benchmark
    public void errorField() {
        logger.warn("this is warn", error(failure));
    }

    @Benchmark
    public void anyFields() {
        logger.info("this is info", any("payload", payload), any("tags", List.of("a", "b", "c")));
    }

    @Benchmark
    public void withTraceContext() {
        contextLogger.info("this is info", string("key", "value"));
    }

    @Benchmark
    public void formatted() {
        logger.infof("user %s logged in %d times", "emp_1001", 3);
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(FieldLoggingBenchmark.class.getSimpleName())
                .build();

        new Runner(opt).run();
    }
}
