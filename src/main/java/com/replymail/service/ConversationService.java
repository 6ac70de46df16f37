package com.replymail.service;

import com.replymail.domain.ConversationTurn;
import com.replymail.domain.TurnDirection;
import com.replymail.mapper.ConversationTurnMapper;
import com.replymail.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Per-sender conversation memory (append-only)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationService {

    private final ConversationTurnMapper mapper;

    public ConversationTurn record(String sender, TurnDirection direction, String content,
                                   String subject, String messageId) {
        ConversationTurn turn = ConversationTurn.builder()
                .sender(key(sender))
                .direction(direction)
                .content(TextNormalizer.normalize(content))
                .subject(TextNormalizer.clean(subject))
                .messageId(messageId)
                .createdAt(Instant.now().toString())
                .build();
        mapper.insert(turn);
        log.debug("Recorded {} turn for {}", direction, turn.getSender());
        return turn;
    }

    /**
     * Last {@code limit} turns, oldest first
     */
    public List<ConversationTurn> recent(String sender, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<ConversationTurn> newestFirst = new ArrayList<>(mapper.findRecentBySender(key(sender), limit));
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    public List<ConversationTurn> history(String sender) {
        return mapper.findBySender(key(sender));
    }

    private static String key(String sender) {
        return TextNormalizer.clean(sender).toLowerCase(Locale.ROOT);
    }
}
