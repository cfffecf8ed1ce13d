package com.secretsync.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SecretSyncPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfiguration.class);

    @Test
    void defaultsApplyWhenOnlyRequiredValuesAreSet() {
        contextRunner
                .withPropertyValues(
                        "secret-sync.gcp.project-id=demo-project",
                        "secret-sync.gcp.secret-name=app-config",
                        "secret-sync.kubernetes.namespace=apps",
                        "secret-sync.kubernetes.secret-name=app-secrets")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    SecretSyncProperties properties = context.getBean(SecretSyncProperties.class);
                    assertThat(properties.getGcp().getSecretVersion()).isEqualTo("latest");
                    assertThat(properties.getSync().interval()).isEqualTo(Duration.ofSeconds(300));
                    assertThat(properties.getSync().failureBackoff()).isEqualTo(Duration.ofSeconds(60));
                    assertThat(properties.getSync().isSchedulerEnabled()).isTrue();
                    assertThat(properties.getApi().isTokenRequired()).isFalse();
                });
    }

    @Test
    void missingRequiredValuesFailStartup() {
        contextRunner
                .withPropertyValues("secret-sync.gcp.project-id=demo-project")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .hasMessageContaining("secret-sync")
                            .hasMessageContaining("is required");
                });
    }

    @Test
    void nonPositiveIntervalIsRejected() {
        contextRunner
                .withPropertyValues(
                        "secret-sync.gcp.project-id=demo-project",
                        "secret-sync.gcp.secret-name=app-config",
                        "secret-sync.kubernetes.namespace=apps",
                        "secret-sync.kubernetes.secret-name=app-secrets",
                        "secret-sync.sync.interval-seconds=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration
    @EnableConfigurationProperties(SecretSyncProperties.class)
    static class PropertiesConfiguration {
    }
}
