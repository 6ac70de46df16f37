package com.replymail.ai;

import com.replymail.config.AssistantProperties;
import com.replymail.domain.ConversationTurn;
import com.replymail.domain.InboxMessage;
import com.replymail.domain.ScoredChunk;
import com.replymail.domain.TurnDirection;
import com.replymail.util.TextNormalizer;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Bounded reply prompt
 * - System: persona, guidelines, top-k context chunks (each length-capped)
 * - User: sender, subject, body (capped), last N turns with the same sender
 * - Context is dropped from the end first when the whole prompt is over budget
 */
@Component
@RequiredArgsConstructor
public class PromptBuilder {

    private final AssistantProperties properties;

    public List<ChatMessage> build(InboxMessage message, List<ConversationTurn> priorTurns,
                                   List<ScoredChunk> context) {
        AssistantProperties.Generator generator = properties.getGenerator();
        String user = userMessage(message, priorTurns);
        int remaining = Math.max(0, generator.getMaxPromptChars() - user.length());
        String system = systemMessage(context, remaining);
        return List.of(SystemMessage.from(system), UserMessage.from(user));
    }

    String systemMessage(List<ScoredChunk> context, int budget) {
        AssistantProperties.Generator generator = properties.getGenerator();
        StringBuilder sb = new StringBuilder()
                .append("You are ").append(generator.getAssistantName())
                .append(", an assistant that answers email on behalf of its owner.\n")
                .append("Guidelines:\n")
                .append("- Be concise but complete, in a friendly professional tone\n")
                .append("- Reply in the language of the incoming message\n")
                .append("- Use the knowledge base context when it is relevant and do not invent facts\n")
                .append("- If you do not know, say so and suggest a next step\n")
                .append("- Write only the reply body; do not add a subject line\n")
                .append("- End with this signature:\n").append(generator.getSignature()).append('\n');

        if (context != null && !context.isEmpty()) {
            int maxChunkChars = properties.getRetrieval().getMaxChunkChars();
            int topK = properties.getRetrieval().getTopK();
            StringBuilder block = new StringBuilder("\nRelevant context from the knowledge base:\n");
            int used = sb.length() + block.length();
            int n = 0;
            for (ScoredChunk hit : context) {
                if (n >= topK) {
                    break;
                }
                String title = hit.chunk().getTitle() == null || hit.chunk().getTitle().isBlank()
                        ? "" : " (" + hit.chunk().getTitle() + ")";
                String entry = "[Context " + (n + 1) + title + "]\n"
                        + TextNormalizer.truncate(hit.chunk().getContent(), maxChunkChars) + "\n\n";
                if (used + entry.length() > budget) {
                    break;
                }
                block.append(entry);
                used += entry.length();
                n++;
            }
            if (n > 0) {
                sb.append(block);
            }
        }
        return sb.toString().strip();
    }

    String userMessage(InboxMessage message, List<ConversationTurn> priorTurns) {
        AssistantProperties.Generator generator = properties.getGenerator();
        StringBuilder sb = new StringBuilder()
                .append("Email from: ").append(message.senderName())
                .append(" <").append(message.senderAddress()).append(">\n")
                .append("Subject: ").append(message.subject()).append("\n\n")
                .append("Message:\n")
                .append(TextNormalizer.truncate(message.body(), generator.getMaxBodyChars()));

        if (priorTurns != null && !priorTurns.isEmpty()) {
            int from = Math.max(0, priorTurns.size() - generator.getMaxHistoryTurns());
            sb.append("\n\nPrevious conversation (oldest first):\n");
            for (ConversationTurn turn : priorTurns.subList(from, priorTurns.size())) {
                sb.append("- ")
                        .append(turn.getDirection() == TurnDirection.OUTGOING ? "assistant" : "user")
                        .append(": ")
                        .append(TextNormalizer.truncate(TextNormalizer.clean(turn.getContent()),
                                generator.getMaxHistoryChars()))
                        .append('\n');
            }
        }
        return sb.toString().strip();
    }
}
