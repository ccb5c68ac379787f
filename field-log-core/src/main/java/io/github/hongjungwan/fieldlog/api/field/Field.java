package io.github.hongjungwan.fieldlog.api.field;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 하나의 로그 호출에 첨부되는 불변 key/value 필드. {@link Fields}로 생성.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Field {

    private final String key;
    private final FieldType type;
    private final Object value;

    Field(String key, FieldType type, Object value) {
        this.key = key;
        this.type = type;
        this.value = value;
    }

    public boolean isSkipped() {
        return type == FieldType.SKIP;
    }
}
