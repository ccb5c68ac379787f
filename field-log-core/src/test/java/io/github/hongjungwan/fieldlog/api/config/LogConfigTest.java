package io.github.hongjungwan.fieldlog.api.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LogConfig 테스트")
class LogConfigTest {

    @Nested
    @DisplayName("레벨 해석")
    class LevelTests {

        @ParameterizedTest
        @CsvSource({
                "debug, DEBUG", "DEBUG, DEBUG", "Debug, DEBUG",
                "info, INFO", "INFO, INFO", "iNfO, INFO",
                "warn, WARN", "WARN, WARN", "wArN, WARN",
                "error, ERROR", "ERROR, ERROR", "ErRoR, ERROR"
        })
        @DisplayName("대소문자와 무관하게 레벨을 해석해야 한다")
        void shouldResolveKnownLevelsIgnoringCase(String raw, LogLevel expected) {
            assertThat(LogConfig.resolve(false, "", raw).getLevel()).isEqualTo(expected);
        }

        @ParameterizedTest
        @ValueSource(strings = {"trace", "warning", "fatal", "panic", "verbose", " ", " info", "info ", " warn "})
        @NullAndEmptySource
        @DisplayName("알 수 없는 레벨은 DEBUG로 처리해야 한다")
        void shouldFallBackToDebug(String raw) {
            assertThat(LogLevel.parse(raw)).isEqualTo(LogLevel.DEBUG);
            assertThat(LogConfig.resolve(false, "", raw).getLevel()).isEqualTo(LogLevel.DEBUG);
        }
    }

    @Nested
    @DisplayName("파일 출력")
    class FileSinkTests {

        @Test
        @DisplayName("파일 경로가 비어 있으면 기본 파일명을 사용해야 한다")
        void shouldUseDefaultFileNameWhenPathEmpty() {
            LogConfig config = LogConfig.resolve(true, "", "info");

            assertThat(config.getFilePath()).isEqualTo(LogConfig.DEFAULT_FILE_PATH).isEqualTo("out.log");
        }

        @Test
        @DisplayName("null 경로도 기본 파일명으로 대체해야 한다")
        void shouldUseDefaultFileNameWhenPathNull() {
            assertThat(LogConfig.resolve(true, null, "info").getFilePath()).isEqualTo("out.log");
        }

        @Test
        @DisplayName("지정한 파일 경로를 유지해야 한다")
        void shouldKeepGivenPath() {
            assertThat(LogConfig.resolve(true, "logs/app.log", "info").getFilePath()).isEqualTo("logs/app.log");
        }

        @ParameterizedTest
        @ValueSource(strings = {"console", "json", "text", ""})
        @DisplayName("파일 출력은 encoding 인자와 무관하게 항상 JSON이어야 한다")
        void shouldAlwaysUseJsonForFiles(String encoding) {
            assertThat(LogConfig.resolve(true, "app.log", "info", encoding).getEncoding()).isEqualTo(Encoding.JSON);
            assertThat(LogConfig.resolve(true, "app.log", "info").getEncoding()).isEqualTo(Encoding.JSON);
        }

        @Test
        @DisplayName("builder로 CONSOLE을 지정해도 파일 출력은 JSON이어야 한다")
        void shouldOverrideBuilderEncodingForFiles() {
            LogConfig config = LogConfig.builder()
                    .saveToFile(true)
                    .encoding(Encoding.CONSOLE)
                    .build();

            assertThat(config.getEncoding()).isEqualTo(Encoding.JSON);
            assertThat(config.getFilePath()).isEqualTo("out.log");
        }
    }

    @Nested
    @DisplayName("콘솔 출력")
    class ConsoleSinkTests {

        @Test
        @DisplayName("json을 지정하면 JSON으로 출력해야 한다")
        void shouldUseJsonWhenRequested() {
            assertThat(LogConfig.resolve(false, "", "debug", "json").getEncoding()).isEqualTo(Encoding.JSON);
        }

        @ParameterizedTest
        @ValueSource(strings = {"console", "JSON", "xml", ""})
        @DisplayName("json 이외의 값은 console 포맷이어야 한다")
        void shouldUseConsoleOtherwise(String encoding) {
            assertThat(LogConfig.resolve(false, "", "debug", encoding).getEncoding()).isEqualTo(Encoding.CONSOLE);
        }

        @Test
        @DisplayName("encoding을 생략하면 console 포맷이어야 한다")
        void shouldDefaultToConsole() {
            LogConfig config = LogConfig.resolve(false, "ignored.log", "debug");

            assertThat(config.getEncoding()).isEqualTo(Encoding.CONSOLE);
            assertThat(config.getFilePath()).isNull();
        }

        @Test
        @DisplayName("encoding 배열이 null이어도 console 포맷이어야 한다")
        void shouldTolerateNullEncodingArray() {
            assertThat(LogConfig.resolve(false, "", "debug", (String[]) null).getEncoding())
                    .isEqualTo(Encoding.CONSOLE);
        }
    }

    @Nested
    @DisplayName("기본 설정")
    class DefaultConfigTests {

        @Test
        @DisplayName("기본 설정은 콘솔, DEBUG, console 포맷이어야 한다")
        void shouldHaveCorrectDefaults() {
            LogConfig config = LogConfig.defaultConfig();

            assertThat(config.isSaveToFile()).isFalse();
            assertThat(config.getLevel()).isEqualTo(LogLevel.DEBUG);
            assertThat(config.getEncoding()).isEqualTo(Encoding.CONSOLE);
            assertThat(config.getStacktraceLevel()).isEqualTo(LogLevel.ERROR);
            assertThat(config.getOutput()).isNull();
            assertThat(config.getTerminator()).isNotNull();
        }

        @Test
        @DisplayName("설정 요약 문자열을 만들어야 한다")
        void shouldDescribeResolvedConfig() {
            assertThat(LogConfig.resolve(true, "", "warn").describe())
                    .isEqualTo("saveToFile=true, filePath=out.log, level=WARN, encoding=json");
            assertThat(LogConfig.resolve(false, "", "error", "json").describe())
                    .isEqualTo("saveToFile=false, level=ERROR, encoding=json");
        }

        @Test
        @DisplayName("요약은 해석된 레벨을 보여줘야 한다")
        void shouldDescribeResolvedLevel() {
            assertThat(LogConfig.resolve(false, "", "verbose").describe())
                    .isEqualTo("saveToFile=false, level=DEBUG, encoding=console");
        }
    }
}
