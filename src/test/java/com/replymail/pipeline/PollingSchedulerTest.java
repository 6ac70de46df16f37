package com.replymail.pipeline;

import com.replymail.config.AssistantProperties;
import com.replymail.domain.CycleReport;
import com.replymail.domain.RunOutcome;
import com.replymail.domain.RunStatus;
import com.replymail.domain.TriggerResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * PollingScheduler unit tests
 */
@ExtendWith(MockitoExtension.class)
class PollingSchedulerTest {

    @Mock
    private MailPipelineOrchestrator orchestrator;

    @Mock
    private ThreadPoolTaskScheduler taskScheduler;

    private AssistantProperties properties;
    private PollingScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new AssistantProperties();
        scheduler = new PollingScheduler(orchestrator, taskScheduler, properties);
    }

    private static RunStatus statusAfter(RunOutcome outcome) {
        Instant now = Instant.now();
        return RunStatus.initial().finished(new CycleReport(now, now, outcome, 0, 0, 0, 0, null));
    }

    @Test
    @DisplayName("Tick runs one cycle")
    void testTick() {
        when(orchestrator.status()).thenReturn(RunStatus.initial());

        scheduler.tick();

        verify(orchestrator).runOnce();
    }

    @Test
    @DisplayName("Tick suspended after an authentication failure")
    void testTickAfterAuthenticationFailure() {
        when(orchestrator.status()).thenReturn(statusAfter(RunOutcome.AUTHENTICATION_FAILED));

        scheduler.tick();

        verify(orchestrator, never()).runOnce();
    }

    @Test
    @DisplayName("Unexpected failure does not escape the tick")
    void testTickSurvivesFailure() {
        when(orchestrator.status()).thenReturn(statusAfter(RunOutcome.SUCCESS));
        when(orchestrator.runOnce()).thenThrow(new IllegalStateException("boom"));

        assertThatCode(() -> scheduler.tick()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Polling disabled: nothing scheduled")
    void testStartDisabled() {
        properties.getPolling().setEnabled(false);

        scheduler.start();

        verifyNoInteractions(taskScheduler);
    }

    @Test
    @DisplayName("Polling enabled: fixed-delay schedule registered")
    void testStartEnabled() {
        scheduler.start();

        verify(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Instant.class),
                any(Duration.class));
    }

    @Test
    @DisplayName("Manual trigger delegates to the orchestrator on the pipeline executor")
    void testTriggerNow() {
        when(orchestrator.trigger(taskScheduler)).thenReturn(TriggerResult.ALREADY_RUNNING);

        assertThat(scheduler.triggerNow()).isEqualTo(TriggerResult.ALREADY_RUNNING);
    }

    @Test
    @DisplayName("Stop requests a graceful stop and waits for idle")
    void testStop() throws InterruptedException {
        when(orchestrator.awaitIdle(any())).thenReturn(true);

        scheduler.stop();

        verify(orchestrator).requestStop();
        verify(orchestrator).awaitIdle(Duration.ofMillis(properties.getPolling().getShutdownGraceMs()));
    }
}
