package com.replymail.pipeline;

import com.replymail.ai.ContentEvaluator;
import com.replymail.ai.ReplyGenerator;
import com.replymail.config.AssistantProperties;
import com.replymail.domain.ConversationTurn;
import com.replymail.domain.CycleReport;
import com.replymail.domain.EvaluationDecision;
import com.replymail.domain.GeneratedReply;
import com.replymail.domain.InboxMessage;
import com.replymail.domain.OutgoingReply;
import com.replymail.domain.RawMessage;
import com.replymail.domain.RunOutcome;
import com.replymail.domain.RunStatus;
import com.replymail.domain.ScoredChunk;
import com.replymail.domain.TriggerResult;
import com.replymail.domain.TurnDirection;
import com.replymail.exception.LedgerWriteException;
import com.replymail.exception.MailAuthenticationException;
import com.replymail.exception.MessageParseException;
import com.replymail.ledger.ProcessedLedger;
import com.replymail.mail.MailTransport;
import com.replymail.mail.MessageParser;
import com.replymail.rag.RetrievalIndex;
import com.replymail.service.ConversationService;
import com.replymail.util.TextNormalizer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ingestion-and-reply pipeline
 *
 * One cycle: fetch unread -> per message:
 * parse -> ledger check -> evaluate -> (retrieve) -> generate -> send -> commit -> remember -> mark read
 *
 * - Single run-lock: scheduled and manual runs never overlap
 * - Per-message failures are isolated; authentication and ledger failures abort the cycle
 * - Status reads are lock-free snapshots
 */
@Slf4j
@Component
public class MailPipelineOrchestrator {

    private final MailTransport transport;
    private final MessageParser parser;
    private final ProcessedLedger ledger;
    private final ContentEvaluator evaluator;
    private final RetrievalIndex retrievalIndex;
    private final ReplyGenerator replyGenerator;
    private final ConversationService conversationService;
    private final RetryPolicy retryPolicy;
    private final AssistantProperties properties;
    private final MeterRegistry meterRegistry;

    private final Semaphore runLock = new Semaphore(1);
    private final AtomicReference<RunStatus> status = new AtomicReference<>(RunStatus.initial());
    private volatile boolean stopRequested = false;

    private final Counter repliedCounter;
    private final Counter skippedCounter;
    private final Counter failedCounter;

    public MailPipelineOrchestrator(MailTransport transport,
                                    MessageParser parser,
                                    ProcessedLedger ledger,
                                    ContentEvaluator evaluator,
                                    RetrievalIndex retrievalIndex,
                                    ReplyGenerator replyGenerator,
                                    ConversationService conversationService,
                                    RetryPolicy retryPolicy,
                                    AssistantProperties properties,
                                    MeterRegistry meterRegistry) {
        this.transport = transport;
        this.parser = parser;
        this.ledger = ledger;
        this.evaluator = evaluator;
        this.retrievalIndex = retrievalIndex;
        this.replyGenerator = replyGenerator;
        this.conversationService = conversationService;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.repliedCounter = Counter.builder("replymail.messages.replied")
                .description("Messages answered and committed")
                .register(meterRegistry);
        this.skippedCounter = Counter.builder("replymail.messages.skipped")
                .description("Messages skipped as already processed")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("replymail.messages.failed")
                .description("Messages that failed in isolation")
                .register(meterRegistry);
    }

    /**
     * Run one cycle on the calling thread
     *
     * @return the report, or empty when another run holds the lock or a stop was requested
     */
    public Optional<CycleReport> runOnce() {
        if (stopRequested) {
            return Optional.empty();
        }
        if (!runLock.tryAcquire()) {
            log.info("Pipeline already running, skipping this run");
            return Optional.empty();
        }
        try {
            return Optional.of(runCycle());
        } finally {
            runLock.release();
        }
    }

    /**
     * Start one cycle on the given executor unless a run is in flight
     */
    public TriggerResult trigger(Executor executor) {
        if (stopRequested) {
            return TriggerResult.REJECTED;
        }
        if (!runLock.tryAcquire()) {
            log.info("Manual trigger coalesced: pipeline already running");
            return TriggerResult.ALREADY_RUNNING;
        }
        try {
            executor.execute(() -> {
                try {
                    runCycle();
                } finally {
                    runLock.release();
                }
            });
            return TriggerResult.ACCEPTED;
        } catch (RejectedExecutionException e) {
            runLock.release();
            log.warn("Trigger rejected by executor: {}", e.getMessage());
            return TriggerResult.REJECTED;
        }
    }

    public RunStatus status() {
        return status.get();
    }

    public boolean isRunning() {
        return runLock.availablePermits() == 0;
    }

    /**
     * Finish the current message, start no new one
     */
    public void requestStop() {
        stopRequested = true;
    }

    /**
     * Wait until no cycle holds the run-lock
     *
     * @return true when idle within the timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        if (!runLock.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            return false;
        }
        runLock.release();
        return true;
    }

    /**
     * Caller must hold the run-lock. Never throws.
     */
    CycleReport runCycle() {
        Instant startedAt = Instant.now();
        status.updateAndGet(RunStatus::started);
        Tally tally = new Tally();
        RunOutcome outcome;
        String error = null;

        try {
            // 1. Fetch
            List<RawMessage> batch = null;
            try {
                batch = retryPolicy.execute(OperationKind.FETCH,
                        () -> transport.fetchUnread(properties.getPolling().getMaxMessagesPerBatch()));
            } catch (MailAuthenticationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Mailbox fetch failed: {}", e.getMessage());
                error = e.getMessage();
            }

            if (batch == null) {
                outcome = RunOutcome.FETCH_FAILED;
            } else {
                tally.fetched = batch.size();
                // 2. Process in fetch order
                for (RawMessage raw : batch) {
                    if (stopRequested) {
                        log.info("Stop requested, leaving remaining messages for the next cycle");
                        break;
                    }
                    processMessage(raw, tally);
                }
                outcome = tally.failed > 0 ? RunOutcome.PARTIAL_FAILURE : RunOutcome.SUCCESS;
                if (tally.failed > 0) {
                    error = tally.failed + " message(s) failed";
                }
            }

        } catch (MailAuthenticationException e) {
            log.error("Mail authentication failed, aborting cycle: {}", e.getMessage());
            outcome = RunOutcome.AUTHENTICATION_FAILED;
            error = e.getMessage();
        } catch (LedgerWriteException e) {
            log.error("Ledger failure, aborting cycle: {}", e.getMessage(), e);
            outcome = RunOutcome.LEDGER_FAILURE;
            error = e.getMessage();
        } catch (RuntimeException e) {
            log.error("Unexpected pipeline failure", e);
            outcome = RunOutcome.ERROR;
            error = e.getMessage();
        } finally {
            try {
                transport.disconnect();
            } catch (RuntimeException e) {
                log.warn("Mailbox disconnect failed: {}", e.getMessage());
            }
        }

        CycleReport report = new CycleReport(startedAt, Instant.now(), outcome,
                tally.fetched, tally.replied, tally.skipped, tally.failed, error);
        status.updateAndGet(s -> s.finished(report));
        Counter.builder("replymail.cycles")
                .description("Pipeline cycles by outcome")
                .tag("outcome", outcome.name())
                .register(meterRegistry)
                .increment();
        log.info("Cycle finished: outcome={} fetched={} replied={} skipped={} failed={} in {}ms",
                outcome, tally.fetched, tally.replied, tally.skipped, tally.failed,
                Duration.between(startedAt, report.finishedAt()).toMillis());
        return report;
    }

    private void processMessage(RawMessage raw, Tally tally) {
        // Parse
        stage(PipelineStage.PARSING);
        InboxMessage message;
        try {
            message = parser.parse(raw);
        } catch (MessageParseException e) {
            log.warn("Skipping unparseable message uid={}: {}", raw.uid(), e.getMessage());
            fail(tally);
            return;
        }

        // Ledger check; a failure here propagates and aborts the cycle
        String key = message.ledgerKey();
        if (ledger.isProcessed(key)) {
            log.info("Message {} already answered, marking read", key);
            markRead(raw.uid());
            tally.skipped++;
            skippedCounter.increment();
            return;
        }

        GeneratedReply reply;
        try {
            stage(PipelineStage.EVALUATING);
            EvaluationDecision decision = evaluator.evaluate(message);

            List<ScoredChunk> context = List.of();
            if (decision.needsRetrieval()) {
                stage(PipelineStage.RETRIEVING);
                context = retrieve(decision.query());
            }

            stage(PipelineStage.GENERATING);
            reply = replyGenerator.generate(message, history(message.senderAddress()), context);

            stage(PipelineStage.SENDING);
            OutgoingReply outgoing = OutgoingReply.answering(message, reply.text());
            retryPolicy.run(OperationKind.SEND, () -> transport.send(outgoing));

        } catch (MailAuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Message uid={} from {} failed: {}", raw.uid(),
                    TextNormalizer.clean(message.senderAddress()), e.getMessage());
            fail(tally);
            return;
        }

        // Commit before mark-read
        stage(PipelineStage.COMMITTING);
        ledger.commit(key, Instant.now());
        tally.replied++;
        repliedCounter.increment();
        log.info("Replied to {} subject={} fallback={} context={}", message.senderAddress(),
                message.subject(), reply.fallback(), reply.contextChunks());

        remember(message, reply);
        markRead(raw.uid());
    }

    private List<ScoredChunk> retrieve(String query) {
        try {
            return retrievalIndex.search(query, properties.getRetrieval().getTopK());
        } catch (RuntimeException e) {
            log.warn("Retrieval unavailable, replying without context: {}", e.getMessage());
            return List.of();
        }
    }

    private List<ConversationTurn> history(String sender) {
        try {
            return conversationService.recent(sender, properties.getGenerator().getMaxHistoryTurns());
        } catch (RuntimeException e) {
            log.warn("Conversation history unavailable for {}: {}", sender, e.getMessage());
            return List.of();
        }
    }

    private void remember(InboxMessage message, GeneratedReply reply) {
        String messageId = message.messageId().orElse(message.ledgerKey());
        try {
            conversationService.record(message.senderAddress(), TurnDirection.INCOMING,
                    message.body(), message.subject(), messageId);
            conversationService.record(message.senderAddress(), TurnDirection.OUTGOING,
                    reply.text(), OutgoingReply.replySubject(message.subject()), messageId);
        } catch (RuntimeException e) {
            log.warn("Could not record conversation for {}: {}", message.senderAddress(), e.getMessage());
        }
    }

    private void markRead(long uid) {
        try {
            retryPolicy.run(OperationKind.FETCH, () -> transport.markRead(uid));
        } catch (RuntimeException e) {
            log.warn("Mark-read failed for uid={}, the ledger will skip it next cycle: {}", uid, e.getMessage());
        }
    }

    private void fail(Tally tally) {
        tally.failed++;
        failedCounter.increment();
    }

    private void stage(PipelineStage stage) {
        status.updateAndGet(s -> s.withStage(stage));
    }

    private static final class Tally {
        private int fetched;
        private int replied;
        private int skipped;
        private int failed;
    }
}
