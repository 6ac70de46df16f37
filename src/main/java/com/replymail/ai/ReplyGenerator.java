package com.replymail.ai;

import com.replymail.config.AssistantProperties;
import com.replymail.domain.ConversationTurn;
import com.replymail.domain.GeneratedReply;
import com.replymail.domain.InboxMessage;
import com.replymail.domain.ScoredChunk;
import com.replymail.pipeline.OperationKind;
import com.replymail.pipeline.RetryPolicy;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reply text generation
 * - Empty body: fixed acknowledgement, no model call
 * - Model failure, timeout or empty output: safe fallback reply
 * Never throws for a single message.
 */
@Slf4j
@Component
public class ReplyGenerator {

    private final ChatModel chatModel;
    private final PromptBuilder promptBuilder;
    private final RetryPolicy retryPolicy;
    private final AssistantProperties properties;

    public ReplyGenerator(@Qualifier("replyChatModel") ChatModel chatModel,
                          PromptBuilder promptBuilder,
                          RetryPolicy retryPolicy,
                          AssistantProperties properties) {
        this.chatModel = chatModel;
        this.promptBuilder = promptBuilder;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
    }

    public GeneratedReply generate(InboxMessage message, List<ConversationTurn> priorTurns,
                                   List<ScoredChunk> context) {
        if (!message.hasBody()) {
            log.info("Empty body from {}, sending acknowledgement", message.senderAddress());
            return new GeneratedReply(acknowledgement(message), true, 0);
        }

        List<ChatMessage> prompt = promptBuilder.build(message, priorTurns, context);
        int contextChunks = context == null ? 0 : Math.min(context.size(), properties.getRetrieval().getTopK());
        try {
            String text = retryPolicy.execute(OperationKind.GENERATE, () -> {
                ChatResponse response = chatModel.chat(prompt);
                AiMessage ai = response == null ? null : response.aiMessage();
                return ai == null || ai.text() == null ? "" : ai.text().strip();
            });
            if (text == null || text.isEmpty()) {
                log.warn("Model returned an empty reply for uid={}, using fallback", message.uid());
                return new GeneratedReply(fallback(message), true, contextChunks);
            }
            log.debug("Generated {} chars for uid={} with {} context chunk(s)", text.length(),
                    message.uid(), contextChunks);
            return new GeneratedReply(text, false, contextChunks);

        } catch (RuntimeException e) {
            log.error("Reply generation failed for uid={}: {}", message.uid(), e.getMessage());
            return new GeneratedReply(fallback(message), true, contextChunks);
        }
    }

    String acknowledgement(InboxMessage message) {
        return "Hi " + firstName(message) + ",\n\n"
                + "Thanks for your email. It arrived without any text, so there was nothing for me to answer yet. "
                + "If you meant to ask something, just reply with your question and I will get back to you.\n\n"
                + properties.getGenerator().getSignature();
    }

    String fallback(InboxMessage message) {
        return "Hi " + firstName(message) + ",\n\n"
                + "Thanks for your email about \"" + message.subject() + "\". "
                + "I have received your message but cannot give you a full answer right now. "
                + "I will follow up as soon as I can.\n\n"
                + properties.getGenerator().getSignature();
    }

    private static String firstName(InboxMessage message) {
        String name = message.senderName() == null || message.senderName().isBlank()
                ? message.senderAddress() : message.senderName();
        if (name == null || name.isBlank()) {
            return "there";
        }
        if (name.contains("@")) {
            return name.substring(0, name.indexOf('@'));
        }
        return name.strip().split("\\s+")[0];
    }
}
