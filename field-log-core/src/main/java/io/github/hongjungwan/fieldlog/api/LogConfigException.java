package io.github.hongjungwan.fieldlog.api;

/**
 * 로거 설정 조립 또는 엔진 빌드 실패.
 */
public class LogConfigException extends RuntimeException {

    public LogConfigException(String message) {
        super(message);
    }

    public LogConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
