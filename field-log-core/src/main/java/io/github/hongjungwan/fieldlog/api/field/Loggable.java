package io.github.hongjungwan.fieldlog.api.field;

/**
 * 자체 구조화 값을 제공하는 타입. 리플렉션 직렬화 대신 사용.
 *
 * <p>The returned value may be a primitive wrapper, a string, a {@code Map},
 * a {@code Collection} or another {@code Loggable}; nested values are resolved
 * with the same rules as {@link Fields#any(String, Object)}.</p>
 *
 * <pre>{@code
 * record Employee(String name, int age) implements Loggable {
 *     public Object toLogValue() {
 *         return Map.of("name", name, "age", age);
 *     }
 * }
 * }</pre>
 */
@FunctionalInterface
public interface Loggable {

    Object toLogValue();
}
