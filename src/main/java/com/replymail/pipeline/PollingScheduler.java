package com.replymail.pipeline;

import com.replymail.config.AssistantProperties;
import com.replymail.domain.RunOutcome;
import com.replymail.domain.TriggerResult;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Run-on-interval and run-now, both funnelled through the orchestrator's run-lock
 * - Scheduled runs pause after an authentication failure until a manual run clears it
 * - Shutdown lets the current message finish, bounded by the grace period
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PollingScheduler {

    private final MailPipelineOrchestrator orchestrator;
    private final ThreadPoolTaskScheduler pipelineTaskScheduler;
    private final AssistantProperties properties;

    private ScheduledFuture<?> future;

    @PostConstruct
    public void start() {
        AssistantProperties.Polling polling = properties.getPolling();
        if (!polling.isEnabled()) {
            log.info("Scheduled polling disabled; manual trigger only");
            return;
        }
        future = pipelineTaskScheduler.scheduleWithFixedDelay(this::tick,
                Instant.now().plusMillis(polling.getInitialDelayMs()),
                Duration.ofMillis(polling.getIntervalMs()));
        log.info("Polling every {}ms (first run in {}ms)", polling.getIntervalMs(), polling.getInitialDelayMs());
    }

    void tick() {
        if (orchestrator.status().lastOutcome() == RunOutcome.AUTHENTICATION_FAILED) {
            log.warn("Scheduled run suspended after authentication failure; fix credentials and trigger manually");
            return;
        }
        try {
            orchestrator.runOnce();
        } catch (RuntimeException e) {
            // keep the fixed-delay schedule alive
            log.error("Scheduled run failed", e);
        }
    }

    public TriggerResult triggerNow() {
        TriggerResult result = orchestrator.trigger(pipelineTaskScheduler);
        log.info("Manual trigger: {}", result);
        return result;
    }

    @PreDestroy
    public void stop() {
        if (future != null) {
            future.cancel(false);
        }
        orchestrator.requestStop();
        long graceMs = properties.getPolling().getShutdownGraceMs();
        try {
            if (!orchestrator.awaitIdle(Duration.ofMillis(graceMs))) {
                log.warn("Pipeline still running after {}ms grace period", graceMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the pipeline to stop");
        }
        log.info("Polling scheduler stopped");
    }
}
