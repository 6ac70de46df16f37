package com.replymail.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.replymail.config.AssistantProperties;
import com.replymail.domain.EvaluationDecision;
import com.replymail.domain.EvaluationDecision.Source;
import com.replymail.domain.InboxMessage;
import com.replymail.pipeline.RetryPolicy;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ContentEvaluator unit tests
 */
@ExtendWith(MockitoExtension.class)
class ContentEvaluatorTest {

    private static final String STATEMENT =
            "I wanted to let you know that our team meeting moved to Thursday afternoon this week.";

    @Mock
    private ChatModel chatModel;

    private AssistantProperties properties;
    private ContentEvaluator evaluator;

    @BeforeEach
    void setUp() {
        properties = new AssistantProperties();
        properties.getRetry().getGenerate().setMaxAttempts(1);
        properties.getRetry().getGenerate().setTimeoutMs(5000);
        evaluator = new ContentEvaluator(chatModel, new RetryPolicy(properties), properties, new ObjectMapper());
    }

    private static InboxMessage message(String subject, String body) {
        return InboxMessage.builder()
                .uid(1L)
                .folder("INBOX")
                .senderAddress("alice@example.com")
                .senderName("Alice")
                .subject(subject)
                .body(body)
                .build();
    }

    private static ChatResponse reply(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }

    @Test
    @DisplayName("Empty body: answer directly, no model call")
    void testEmptyBody() {
        EvaluationDecision decision = evaluator.evaluate(message("Hello", ""));

        assertThat(decision.needsRetrieval()).isFalse();
        assertThat(decision.source()).isEqualTo(Source.HEURISTIC);
        verify(chatModel, never()).chat(anyList());
    }

    @Test
    @DisplayName("Unsubscribe request is transactional")
    void testTransactional() {
        EvaluationDecision decision = evaluator.evaluate(message("Newsletter", "Please unsubscribe me from this list"));

        assertThat(decision.needsRetrieval()).isFalse();
        assertThat(decision.rationale()).isEqualTo("Transactional message");
    }

    @Test
    @DisplayName("Question triggers retrieval with a derived query")
    void testQuestion() {
        EvaluationDecision decision = evaluator.evaluate(message("Re: Refunds", "What is your refund policy?"));

        assertThat(decision.needsRetrieval()).isTrue();
        assertThat(decision.query()).isEqualTo("Refunds What is your refund policy?");
        assertThat(decision.source()).isEqualTo(Source.HEURISTIC);
        verify(chatModel, never()).chat(anyList());
    }

    @Test
    @DisplayName("Document mention triggers retrieval")
    void testDocumentMention() {
        EvaluationDecision decision = evaluator.evaluate(
                message("Follow up", "Please send me the summary from the quarterly report"));

        assertThat(decision.needsRetrieval()).isTrue();
    }

    @Test
    @DisplayName("Short statement answered directly")
    void testShortStatement() {
        EvaluationDecision decision = evaluator.evaluate(message("Thanks", "Thanks a lot!"));

        assertThat(decision.needsRetrieval()).isFalse();
        assertThat(decision.confidence()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("Undecided message goes to the model; fenced JSON accepted")
    void testModelDecision() {
        when(chatModel.chat(anyList())).thenReturn(reply("""
                ```json
                {"needs_retrieval": true, "query": "team meeting schedule", "confidence": 0.82, "reasoning": "schedule lookup"}
                ```"""));

        EvaluationDecision decision = evaluator.evaluate(message("Meeting", STATEMENT));

        assertThat(decision.needsRetrieval()).isTrue();
        assertThat(decision.query()).isEqualTo("team meeting schedule");
        assertThat(decision.confidence()).isEqualTo(0.82);
        assertThat(decision.source()).isEqualTo(Source.MODEL);
    }

    @Test
    @DisplayName("Identical input yields an identical decision with one model call")
    void testDeterministicCache() {
        when(chatModel.chat(anyList())).thenReturn(reply(
                "{\"needs_retrieval\": false, \"query\": \"\", \"confidence\": 0.9, \"reasoning\": \"info only\"}"));

        EvaluationDecision first = evaluator.evaluate(message("Meeting", STATEMENT));
        EvaluationDecision second = evaluator.evaluate(message("Meeting", STATEMENT));

        assertThat(second).isEqualTo(first);
        verify(chatModel, times(1)).chat(anyList());
    }

    @Test
    @DisplayName("Model failure: answer directly, decision not memoised")
    void testModelFailure() {
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException("read timed out"));

        EvaluationDecision first = evaluator.evaluate(message("Meeting", STATEMENT));
        evaluator.evaluate(message("Meeting", STATEMENT));

        assertThat(first.needsRetrieval()).isFalse();
        assertThat(first.source()).isEqualTo(Source.FALLBACK);
        verify(chatModel, times(2)).chat(anyList());
    }

    @Test
    @DisplayName("Model disabled: undecided message answered directly")
    void testModelDisabled() {
        properties.getEvaluator().setModelAssisted(false);

        EvaluationDecision decision = evaluator.evaluate(message("Meeting", STATEMENT));

        assertThat(decision.needsRetrieval()).isFalse();
        verify(chatModel, never()).chat(anyList());
    }

    @Test
    @DisplayName("Unreadable model output falls back")
    void testParseGarbage() {
        EvaluationDecision decision = evaluator.parseDecision("I think you should look it up", message("s", STATEMENT));

        assertThat(decision.source()).isEqualTo(Source.FALLBACK);
        assertThat(decision.needsRetrieval()).isFalse();
    }

    @Test
    @DisplayName("Retrieval without a model query uses the derived one")
    void testParseEmptyQuery() {
        EvaluationDecision decision = evaluator.parseDecision(
                "{\"needs_retrieval\": true, \"query\": \"\", \"confidence\": 3}", message("Meeting", STATEMENT));

        assertThat(decision.needsRetrieval()).isTrue();
        assertThat(decision.query()).startsWith("Meeting I wanted");
        assertThat(decision.confidence()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Derived query drops reply prefixes and quoted text")
    void testDeriveQuery() {
        String body = "Is the office open on Friday?\n\nOn Mon, 1 Jan 2024, Bob wrote:\n> old text\n> more";

        String query = evaluator.deriveQuery(message("RE: Fwd: Office hours", body));

        assertThat(query).isEqualTo("Office hours Is the office open on Friday?");
    }
}
