package com.replymail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One message exchanged with a sender. Append-only, ordered by id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationTurn {

    private Long id;
    private String sender;          // correlation key
    private TurnDirection direction;
    private String content;
    private String subject;
    private String messageId;
    private String createdAt;       // ISO-8601
}
