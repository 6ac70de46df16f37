package com.replymail.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.replymail.config.AssistantProperties;
import com.replymail.domain.EvaluationDecision;
import com.replymail.domain.EvaluationDecision.Source;
import com.replymail.domain.InboxMessage;
import com.replymail.pipeline.OperationKind;
import com.replymail.pipeline.RetryPolicy;
import com.replymail.util.DigestUtil;
import com.replymail.util.TextNormalizer;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Retrieval decision per inbound message
 * 1. Heuristics: empty, transactional, question-like, short
 * 2. Evaluator model (temperature 0) for everything else
 * 3. Timeout or model failure -> answer directly without retrieval
 *
 * Decisions are memoised by content fingerprint so identical input yields an identical decision.
 */
@Slf4j
@Component
public class ContentEvaluator {

    private static final Pattern TRANSACTIONAL = Pattern.compile(
            "\\b(unsubscribe|opt[ -]?out|remove me|stop sending|out of (the )?office|auto-?reply"
                    + "|automatic reply|delivery status notification|undeliverable)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern INTERROGATIVE_START = Pattern.compile(
            "^(what|how|why|when|where|who|which|can|could|would|should|is|are|do|does|did|tell me|explain)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern DOCUMENT_MENTION = Pattern.compile(
            "\\b(document|doc|article|file|pdf|report|attachment|knowledge base)s?\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern REPLY_PREFIX = Pattern.compile("^((re|fw|fwd)\\s*:\\s*)+", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTE_HEADER = Pattern.compile("^On .+ wrote:$");

    private static final String SYSTEM_PROMPT = """
            You decide whether an email needs a lookup in the assistant's knowledge base \
            (stored documents and articles) before it is answered.
            Answer with a single JSON object and nothing else:
            {"needs_retrieval": true|false, "query": "<search query or empty>", \
            "confidence": <0.0-1.0>, "reasoning": "<one short sentence>"}
            Greetings, thanks, scheduling and small talk do not need retrieval. \
            Questions about facts, documents, articles or topics do.""";

    private final ChatModel chatModel;
    private final RetryPolicy retryPolicy;
    private final AssistantProperties.Evaluator config;
    private final ObjectMapper objectMapper;
    private final Map<String, EvaluationDecision> cache;

    public ContentEvaluator(@Qualifier("evaluatorChatModel") ChatModel chatModel,
                            RetryPolicy retryPolicy,
                            AssistantProperties properties,
                            ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.retryPolicy = retryPolicy;
        this.config = properties.getEvaluator();
        this.objectMapper = objectMapper;
        int capacity = Math.max(1, config.getCacheSize());
        this.cache = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, EvaluationDecision> eldest) {
                return size() > capacity;
            }
        });
    }

    public EvaluationDecision evaluate(InboxMessage message) {
        String fingerprint = DigestUtil.sha256(message.subject(), message.body(),
                String.valueOf(message.attachmentCount()), String.valueOf(message.linkCount()));
        EvaluationDecision cached = cache.get(fingerprint);
        if (cached != null) {
            log.debug("Evaluator cache hit for uid={}", message.uid());
            return cached;
        }

        EvaluationDecision decision = heuristic(message);
        if (decision == null) {
            decision = config.isModelAssisted()
                    ? classify(message)
                    : EvaluationDecision.direct("No retrieval signal", 0.5, Source.HEURISTIC);
        }
        if (decision.source() != Source.FALLBACK) {
            cache.put(fingerprint, decision);
        }
        log.info("Evaluated uid={}: retrieval={} source={} ({})", message.uid(),
                decision.needsRetrieval(), decision.source(), decision.rationale());
        return decision;
    }

    /**
     * @return a decision, or null when the heuristics have no opinion
     */
    EvaluationDecision heuristic(InboxMessage message) {
        String body = message.body() == null ? "" : message.body();
        if (body.isBlank()) {
            return EvaluationDecision.direct(message.attachmentCount() > 0
                    ? "Attachment without text" : "Empty body", 1.0, Source.HEURISTIC);
        }
        if (body.length() < config.getTransactionalMaxChars()
                && (TRANSACTIONAL.matcher(body).find() || TRANSACTIONAL.matcher(nullToEmpty(message.subject())).find())) {
            return EvaluationDecision.direct("Transactional message", 0.9, Source.HEURISTIC);
        }
        String text = stripQuoted(body);
        if (text.indexOf('?') >= 0
                || INTERROGATIVE_START.matcher(text).find()
                || DOCUMENT_MENTION.matcher(text).find()) {
            return EvaluationDecision.retrieve(deriveQuery(message), "Question or document reference",
                    0.8, Source.HEURISTIC);
        }
        if (text.length() < config.getShortMessageChars()) {
            return EvaluationDecision.direct("Short message without a question", 0.7, Source.HEURISTIC);
        }
        return null;
    }

    private EvaluationDecision classify(InboxMessage message) {
        List<ChatMessage> prompt = List.of(
                SystemMessage.from(SYSTEM_PROMPT),
                UserMessage.from("Subject: " + nullToEmpty(message.subject())
                        + "\nAttachments: " + message.attachmentCount()
                        + "\nLinks: " + message.linkCount()
                        + "\n\nBody:\n" + TextNormalizer.truncate(stripQuoted(message.body()), 2000)));
        try {
            String raw = retryPolicy.execute(OperationKind.GENERATE,
                    () -> chatModel.chat(prompt).aiMessage().text());
            return parseDecision(raw, message);
        } catch (RuntimeException e) {
            log.warn("Evaluator model unavailable for uid={}, answering directly: {}", message.uid(), e.getMessage());
            return EvaluationDecision.direct("Evaluator unavailable", 0.0, Source.FALLBACK);
        }
    }

    EvaluationDecision parseDecision(String raw, InboxMessage message) {
        String json = extractJson(raw);
        if (json == null) {
            log.warn("Evaluator returned no JSON for uid={}", message.uid());
            return EvaluationDecision.direct("Unreadable evaluator output", 0.0, Source.FALLBACK);
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            double confidence = Math.max(0.0, Math.min(1.0, node.path("confidence").asDouble(0.5)));
            String reasoning = node.path("reasoning").asText("");
            if (!node.path("needs_retrieval").asBoolean(false)) {
                return EvaluationDecision.direct(reasoning, confidence, Source.MODEL);
            }
            String query = TextNormalizer.clean(node.path("query").asText(""));
            if (query.isEmpty()) {
                query = deriveQuery(message);
            }
            return EvaluationDecision.retrieve(TextNormalizer.truncate(query, config.getMaxQueryChars()),
                    reasoning, confidence, Source.MODEL);
        } catch (JsonProcessingException e) {
            log.warn("Evaluator JSON unparseable for uid={}: {}", message.uid(), e.getOriginalMessage());
            return EvaluationDecision.direct("Unreadable evaluator output", 0.0, Source.FALLBACK);
        }
    }

    /**
     * Subject without reply prefixes plus the unquoted body
     */
    String deriveQuery(InboxMessage message) {
        String subject = REPLY_PREFIX.matcher(nullToEmpty(message.subject()).strip()).replaceFirst("");
        if ("(No Subject)".equals(subject)) {
            subject = "";
        }
        String query = TextNormalizer.clean((subject + " " + stripQuoted(message.body())).strip());
        return TextNormalizer.truncate(query, config.getMaxQueryChars());
    }

    private static String stripQuoted(String body) {
        if (body == null) {
            return "";
        }
        return body.lines()
                .takeWhile(line -> !QUOTE_HEADER.matcher(line.strip()).matches())
                .filter(line -> !line.stripLeading().startsWith(">"))
                .collect(Collectors.joining("\n"))
                .strip();
    }

    private static String extractJson(String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.strip();
        if (text.startsWith("```")) {
            text = text.replaceAll("^```[a-zA-Z]*\\s*", "").replaceAll("\\s*```$", "");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        return start >= 0 && end > start ? text.substring(start, end + 1) : null;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
