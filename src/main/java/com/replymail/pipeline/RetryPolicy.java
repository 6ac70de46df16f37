package com.replymail.pipeline;

import com.replymail.config.AssistantProperties;
import com.replymail.exception.AssistantException;
import com.replymail.exception.TransientTransportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Bounded retry policy shared by every external call
 * - Per-attempt timeout, exponential backoff capped per operation kind
 * - Only transient failures are retried; authentication and permanent errors pass straight through
 * - Non-idempotent calls (SEND) get no per-attempt timeout; their socket timeouts bound them
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryPolicy {

    private final AssistantProperties properties;

    public <T> T execute(OperationKind kind, Supplier<T> call) {
        AssistantProperties.Attempts attempts = properties.getRetry().forKind(kind);

        Mono<T> mono = Mono.fromSupplier(call).subscribeOn(Schedulers.boundedElastic());
        if (attempts.getTimeoutMs() > 0 && kind.isIdempotent()) {
            mono = mono.timeout(Duration.ofMillis(attempts.getTimeoutMs()))
                    .onErrorMap(TimeoutException.class, e -> new TransientTransportException(
                            kind + " timed out after " + attempts.getTimeoutMs() + "ms", e));
        }
        if (attempts.getMaxAttempts() > 1) {
            mono = mono.retryWhen(Retry.backoff(attempts.getMaxAttempts() - 1,
                            Duration.ofMillis(Math.max(1L, attempts.getInitialBackoffMs())))
                    .maxBackoff(Duration.ofMillis(Math.max(1L, attempts.getMaxBackoffMs())))
                    .filter(e -> isTransient(kind, e))
                    .doBeforeRetry(signal -> log.warn("{} attempt {} failed: {} - retrying",
                            kind, signal.totalRetries() + 1, signal.failure().getMessage()))
                    .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()));
        }

        try {
            return mono.block();
        } catch (RuntimeException e) {
            throw unwrap(e);
        }
    }

    public void run(OperationKind kind, Runnable call) {
        execute(kind, () -> {
            call.run();
            return Boolean.TRUE;
        });
    }

    /**
     * Transport calls retry only on TransientTransportException.
     * Model calls also retry on unclassified runtime failures from the client library.
     */
    static boolean isTransient(OperationKind kind, Throwable e) {
        if (e instanceof TransientTransportException) {
            return true;
        }
        if (e instanceof AssistantException) {
            return false;
        }
        return (kind == OperationKind.GENERATE || kind == OperationKind.EMBED) && e instanceof RuntimeException;
    }

    private static RuntimeException unwrap(RuntimeException e) {
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new TransientTransportException(cause.getMessage(), cause);
    }
}
