package io.github.hongjungwan.fieldlog.core.internal;

import java.util.Arrays;
import java.util.Set;

/**
 * Finds the application frame that issued a log call.
 *
 * The leading run of facade frames is dropped, then {@code skip} more frames,
 * so wrapper functions can attribute records to their own callers.
 */
public final class CallerLocator {

    private static final StackTraceElement[] NONE = new StackTraceElement[0];

    private final Set<String> facadeClasses;

    public CallerLocator(Set<String> facadeClasses) {
        this.facadeClasses = Set.copyOf(facadeClasses);
    }

    /** caller부터 시작하는 스택. 건너뛸 프레임이 스택보다 길면 빈 배열. */
    public StackTraceElement[] locate(StackTraceElement[] stack, int skip) {
        int index = 0;
        while (index < stack.length && isFacadeFrame(stack[index])) {
            index++;
        }
        index += Math.max(0, skip);

        if (index >= stack.length) {
            return NONE;
        }
        return Arrays.copyOfRange(stack, index, stack.length);
    }

    private boolean isFacadeFrame(StackTraceElement frame) {
        String className = frame.getClassName();
        int nested = className.indexOf('$');
        String outer = nested > 0 ? className.substring(0, nested) : className;
        return facadeClasses.contains(outer);
    }
}
