package io.github.hongjungwan.fieldlog.starter;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Field Log SDK 설정 Properties (prefix: field-log).
 */
@Data
@ConfigurationProperties(prefix = "field-log")
public class FieldLogProperties {

    /** SDK 활성화 여부 */
    private boolean enabled = true;

    /** true면 filePath에 JSON으로 기록 */
    private boolean saveToFile = false;

    /** 로그 파일 경로. 비어 있으면 out.log */
    private String filePath = "";

    /** DEBUG, INFO, WARN, ERROR. 그 외 값은 DEBUG */
    private String level = "debug";

    /** 콘솔 출력 포맷: json 또는 console */
    private String encoding = "console";
}
