package com.secretsync.backend.service;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.support.SimpleTriggerContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SyncBackoffTriggerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final SyncBackoffTrigger trigger = new SyncBackoffTrigger(Duration.ofSeconds(300), Duration.ofSeconds(60));

    @Test
    void firstExecutionIsImmediate() {
        SimpleTriggerContext context = new SimpleTriggerContext(Clock.fixed(NOW, ZoneOffset.UTC));

        assertThat(trigger.nextExecution(context)).isEqualTo(NOW);
    }

    @Test
    void successWaitsTheFullInterval() {
        trigger.recordOutcome(true);

        assertThat(trigger.nextExecution(completedAt(NOW))).isEqualTo(NOW.plusSeconds(300));
    }

    @Test
    void failureWaitsOnlyTheBackoff() {
        trigger.recordOutcome(false);

        assertThat(trigger.nextExecution(completedAt(NOW))).isEqualTo(NOW.plusSeconds(60));
    }

    @Test
    void successAfterFailureRestoresTheInterval() {
        trigger.recordOutcome(false);
        Instant retryAt = trigger.nextExecution(completedAt(NOW));
        trigger.recordOutcome(true);

        assertThat(retryAt).isEqualTo(NOW.plusSeconds(60));
        assertThat(trigger.nextExecution(completedAt(retryAt))).isEqualTo(retryAt.plusSeconds(300));
    }

    @Test
    void repeatedFailuresKeepTheFixedBackoff() {
        trigger.recordOutcome(false);
        trigger.recordOutcome(false);

        assertThat(trigger.currentDelay()).isEqualTo(Duration.ofSeconds(60));
    }

    private static SimpleTriggerContext completedAt(Instant completion) {
        return new SimpleTriggerContext(completion.minusSeconds(1), completion.minusSeconds(1), completion);
    }
}
