package io.github.hongjungwan.fieldlog.spi;

/**
 * SPI for ending the process after a fatal record.
 *
 * <p>The facade calls this once the fatal record has been flushed to its sink.
 * Hosts that must not exit (tests, embedded containers) can supply their own
 * implementation through {@code LogConfig.builder().terminator(...)}.</p>
 *
 * <h2>Implementation Example:</h2>
 * <pre>{@code
 * LogConfig config = LogConfig.builder()
 *         .terminator(status -> shutdownHook.run())
 *         .build();
 * }</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProcessTerminator {

    /** Exits the JVM with the given status. */
    ProcessTerminator SYSTEM_EXIT = System::exit;

    /**
     * Terminate the process.
     *
     * @param status exit status, 1 for fatal records
     */
    void terminate(int status);
}
