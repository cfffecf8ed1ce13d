package com.secretsync.backend.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SyncResilienceConfig {

    /**
     * Bounds each adapter call of a cycle. Timed-out calls are cancelled so the worker thread
     * is interrupted instead of finishing in the background.
     */
    @Bean
    public TimeLimiter syncStepTimeLimiter(SecretSyncProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(properties.getSync().stepTimeout())
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("secret-sync-step", config);
    }
}
