package io.github.hongjungwan.fieldlog.core.internal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CallerLocator")
class CallerLocatorTest {

    private final CallerLocator locator = new CallerLocator(Set.of("com.acme.log.Facade", "com.acme.log.Impl"));

    private final StackTraceElement[] stack = {
            frame("com.acme.log.Impl", "emit"),
            frame("com.acme.log.Impl$Child", "info"),
            frame("com.acme.log.Facade", "info"),
            frame("com.acme.app.Wrapper", "logInfo"),
            frame("com.acme.app.Service", "handle"),
            frame("com.acme.app.Main", "main")
    };

    private static StackTraceElement frame(String className, String method) {
        return new StackTraceElement(className, method, className.substring(className.lastIndexOf('.') + 1) + ".java", 1);
    }

    @Test
    @DisplayName("should start at the first frame outside the facade")
    void shouldSkipFacadeFrames() {
        StackTraceElement[] located = locator.locate(stack, 0);

        assertThat(located[0].getClassName()).isEqualTo("com.acme.app.Wrapper");
        assertThat(located).hasSize(3);
    }

    @Test
    @DisplayName("should skip additional frames for wrappers")
    void shouldApplyCallerSkip() {
        assertThat(locator.locate(stack, 1)[0].getClassName()).isEqualTo("com.acme.app.Service");
        assertThat(locator.locate(stack, 2)[0].getClassName()).isEqualTo("com.acme.app.Main");
    }

    @Test
    @DisplayName("should return no frames when skipping past the stack")
    void shouldReturnEmptyWhenSkippingTooFar() {
        assertThat(locator.locate(stack, 10)).isEmpty();
    }

    @Test
    @DisplayName("should treat negative skips as zero")
    void shouldIgnoreNegativeSkip() {
        assertThat(locator.locate(stack, -3)[0].getClassName()).isEqualTo("com.acme.app.Wrapper");
    }
}
