package io.github.hongjungwan.fieldlog.starter;

import io.github.hongjungwan.fieldlog.api.Log;
import io.github.hongjungwan.fieldlog.api.LogFacade;
import io.github.hongjungwan.fieldlog.api.config.LogConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;

/**
 * Field Log SDK Spring Boot 자동 설정.
 */
@AutoConfiguration
@EnableConfigurationProperties(FieldLogProperties.class)
@ConditionalOnProperty(prefix = "field-log", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class FieldLogAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public LogConfig fieldLogConfig(FieldLogProperties properties) {
        return LogConfig.resolve(
                properties.isSaveToFile(),
                properties.getFilePath(),
                properties.getLevel(),
                properties.getEncoding());
    }

    /** 기본은 프로세스 전역 Facade. 정적 {@link Log} 호출과 같은 엔진을 공유. */
    @Bean
    @ConditionalOnMissingBean
    public LogFacade logFacade() {
        return Log.facade();
    }

    @Bean
    public FieldLogLifecycle fieldLogLifecycle(LogFacade facade, LogConfig config) {
        return new FieldLogLifecycle(facade, config);
    }

    /**
     * 컨텍스트 시작 시 Facade 초기화, 종료 시 엔진 정지.
     */
    static class FieldLogLifecycle implements SmartLifecycle {

        private final LogFacade facade;
        private final LogConfig config;
        private volatile boolean running = false;

        FieldLogLifecycle(LogFacade facade, LogConfig config) {
            this.facade = facade;
            this.config = config;
        }

        @Override
        public void start() {
            log.info("Starting Field Log SDK with {}", config.describe());
            facade.initialize(config);
            running = true;
        }

        @Override
        public void stop() {
            log.info("Stopping Field Log SDK...");
            facade.close();
            running = false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }
    }
}
