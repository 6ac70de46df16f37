package com.replymail.ai;

import com.replymail.config.AssistantProperties;
import com.replymail.domain.ConversationTurn;
import com.replymail.domain.DocumentChunk;
import com.replymail.domain.InboxMessage;
import com.replymail.domain.ScoredChunk;
import com.replymail.domain.TurnDirection;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * PromptBuilder unit tests
 */
class PromptBuilderTest {

    private AssistantProperties properties;
    private PromptBuilder builder;

    @BeforeEach
    void setUp() {
        properties = new AssistantProperties();
        builder = new PromptBuilder(properties);
    }

    private static InboxMessage message(String body) {
        return InboxMessage.builder()
                .uid(1L)
                .folder("INBOX")
                .senderAddress("alice@example.com")
                .senderName("Alice")
                .subject("Question")
                .body(body)
                .build();
    }

    private static ScoredChunk chunk(String title, String content) {
        return new ScoredChunk(DocumentChunk.builder().chunkId(title).title(title).content(content).build(), 0.5);
    }

    private static ConversationTurn turn(TurnDirection direction, String content) {
        return ConversationTurn.builder().direction(direction).content(content).build();
    }

    @Test
    @DisplayName("System and user messages carry persona, context, sender and history")
    void testBuild() {
        List<ChatMessage> prompt = builder.build(message("What are your hours?"),
                List.of(turn(TurnDirection.INCOMING, "Hi"), turn(TurnDirection.OUTGOING, "Hello Alice")),
                List.of(chunk("Hours", "Open 9 to 5")));

        assertThat(prompt).hasSize(2);
        String system = ((SystemMessage) prompt.get(0)).text();
        String user = ((UserMessage) prompt.get(1)).singleText();
        assertThat(system).contains("ReplyMail Assistant").contains("[Context 1 (Hours)]").contains("Open 9 to 5");
        assertThat(user).contains("Email from: Alice <alice@example.com>")
                .contains("Subject: Question")
                .contains("What are your hours?")
                .contains("- user: Hi")
                .contains("- assistant: Hello Alice");
    }

    @Test
    @DisplayName("No context: no context block")
    void testNoContext() {
        assertThat(builder.systemMessage(List.of(), 10_000)).doesNotContain("[Context");
    }

    @Test
    @DisplayName("Context limited to top-k and truncated per chunk")
    void testContextBounds() {
        properties.getRetrieval().setTopK(2);
        properties.getRetrieval().setMaxChunkChars(10);

        String system = builder.systemMessage(List.of(
                chunk("a", "0123456789abcdef"), chunk("b", "short"), chunk("c", "never shown")), 10_000);

        assertThat(system).contains("0123456789...").doesNotContain("abcdef");
        assertThat(system).contains("[Context 2 (b)]").doesNotContain("never shown");
    }

    @Test
    @DisplayName("Context dropped when the prompt budget is exhausted")
    void testContextBudget() {
        String system = builder.systemMessage(List.of(chunk("a", "some context")), 50);

        assertThat(system).doesNotContain("[Context");
    }

    @Test
    @DisplayName("Only the last N turns, each truncated")
    void testHistoryBounds() {
        properties.getGenerator().setMaxHistoryTurns(2);
        properties.getGenerator().setMaxHistoryChars(5);
        List<ConversationTurn> turns = new ArrayList<>();
        turns.add(turn(TurnDirection.INCOMING, "oldest turn"));
        turns.add(turn(TurnDirection.OUTGOING, "middle turn"));
        turns.add(turn(TurnDirection.INCOMING, "newest turn"));

        String user = builder.userMessage(message("hi"), turns);

        assertThat(user).doesNotContain("oldes").contains("- assistant: middl...").contains("- user: newes...");
    }

    @Test
    @DisplayName("Long body truncated")
    void testBodyTruncated() {
        properties.getGenerator().setMaxBodyChars(20);

        String user = builder.userMessage(message("x".repeat(100)), List.of());

        assertThat(user).contains("x".repeat(20) + "...").doesNotContain("x".repeat(21));
    }
}
