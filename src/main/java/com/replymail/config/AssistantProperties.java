package com.replymail.config;

import com.replymail.pipeline.OperationKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * ReplyMail configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "replymail")
public class AssistantProperties {

    private Mail mail = new Mail();
    private Polling polling = new Polling();
    private Ledger ledger = new Ledger();
    private Retrieval retrieval = new Retrieval();
    private Evaluator evaluator = new Evaluator();
    private Generator generator = new Generator();
    private Ai ai = new Ai();
    private Retry retry = new Retry();

    @Data
    public static class Mail {
        private String username = "";
        private String password = "";
        private String fromAddress = "";
        private String fromName = "ReplyMail Assistant";

        private String imapHost = "imap.gmail.com";
        private int imapPort = 993;
        private boolean imapSsl = true;
        private String folder = "INBOX";

        private String smtpHost = "smtp.gmail.com";
        private int smtpPort = 587;
        private boolean smtpStartTls = true;
        private boolean smtpSsl = false;

        private long connectionTimeout = 10000L;
        private long timeout = 30000L;
        private long maxMessageBytes = 5242880L; // 5MB
        private boolean debug = false;

        /**
         * Envelope sender for replies; falls back to the login name
         */
        public String getEffectiveFromAddress() {
            String configured = fromAddress == null ? "" : fromAddress.trim();
            return configured.isEmpty() ? username : configured;
        }
    }

    @Data
    public static class Polling {
        private boolean enabled = true;
        private long intervalMs = 300000L;
        private long initialDelayMs = 10000L;
        private int maxMessagesPerBatch = 10;
        private long shutdownGraceMs = 30000L;
    }

    @Data
    public static class Ledger {
        /** sqlite | json */
        private String store = "sqlite";
        private String jsonPath = "data/processed_messages.json";
    }

    @Data
    public static class Retrieval {
        private int maxIndexSize = 10000;
        private int chunkSize = 1000;
        private int chunkOverlap = 200;
        private int topK = 5;
        private int maxChunkChars = 800;
        private double minScore = 0.0;
    }

    @Data
    public static class Evaluator {
        private boolean modelAssisted = true;
        private int shortMessageChars = 40;
        private int transactionalMaxChars = 500;
        private int maxQueryChars = 500;
        private int cacheSize = 256;
    }

    @Data
    public static class Generator {
        private String assistantName = "ReplyMail Assistant";
        private String signature = "Best regards,\nReplyMail Assistant";
        private int maxBodyChars = 4000;
        private int maxHistoryTurns = 5;
        private int maxHistoryChars = 200;
        private int maxPromptChars = 12000;
    }

    @Data
    public static class Ai {
        private String openaiApiKey = "";
        private String chatModel = "gpt-4o-mini";
        private String embeddingModel = "text-embedding-3-small";
        private double replyTemperature = 0.7;
        private double evaluatorTemperature = 0.0;
        private long timeoutSeconds = 60L;
    }

    @Data
    public static class Retry {
        private Attempts fetch = new Attempts(3, 1000L, 10000L, 60000L);
        private Attempts send = new Attempts(4, 1000L, 15000L, 0L);
        private Attempts generate = new Attempts(2, 2000L, 10000L, 90000L);
        private Attempts embed = new Attempts(3, 500L, 5000L, 30000L);

        public Attempts forKind(OperationKind kind) {
            return switch (kind) {
                case FETCH -> fetch;
                case SEND -> send;
                case GENERATE -> generate;
                case EMBED -> embed;
            };
        }
    }

    @Data
    public static class Attempts {
        private int maxAttempts;
        private long initialBackoffMs;
        private long maxBackoffMs;
        private long timeoutMs; // per attempt, 0 = unbounded

        public Attempts() {
            this(1, 0L, 0L, 0L);
        }

        public Attempts(int maxAttempts, long initialBackoffMs, long maxBackoffMs, long timeoutMs) {
            this.maxAttempts = maxAttempts;
            this.initialBackoffMs = initialBackoffMs;
            this.maxBackoffMs = maxBackoffMs;
            this.timeoutMs = timeoutMs;
        }
    }
}
