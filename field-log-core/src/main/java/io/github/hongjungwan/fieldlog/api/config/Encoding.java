package io.github.hongjungwan.fieldlog.api.config;

/**
 * 레코드 직렬화 방식. JSON(구조화) 또는 CONSOLE(사람이 읽는 라인 포맷).
 */
public enum Encoding {
    JSON,
    CONSOLE;

    /** 정확히 "json"일 때만 JSON, 그 외(null 포함)는 CONSOLE */
    public static Encoding parse(String encoding) {
        return "json".equals(encoding) ? JSON : CONSOLE;
    }

    public String configName() {
        return this == JSON ? "json" : "console";
    }
}
