package io.github.hongjungwan.fieldlog.api.field;

/**
 * Semantic type tag of a {@link Field}. Encoders dispatch on it.
 */
public enum FieldType {
    /** signed integer, value is a {@code Long} */
    INT64,
    /** unsigned integer, value is a {@code Long} holding the raw bits */
    UINT64,
    /** unsigned machine word, value is a {@code Long} holding the raw bits */
    UINTPTR,
    FLOAT64,
    BOOL,
    STRING,
    /** arbitrary object rendered with {@code toString()} */
    STRINGER,
    TIME,
    DURATION,
    ERROR,
    /** {@link Loggable} rendered through its own structured value */
    OBJECT,
    ARRAY,
    MAP,
    /** rendered by the reflective JSON encoder */
    REFLECTED,
    /** omitted from the record */
    SKIP
}
