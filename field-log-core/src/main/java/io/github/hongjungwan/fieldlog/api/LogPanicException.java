package io.github.hongjungwan.fieldlog.api;

/**
 * Thrown after a panic-level record has been written. Callers opting into
 * panic-level logging accept the non-local exit; the facade never catches it.
 */
public class LogPanicException extends RuntimeException {

    public LogPanicException(String message) {
        super(message);
    }
}
