package com.replymail.mapper;

import com.replymail.domain.ConversationTurn;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface ConversationTurnMapper {

    void insert(ConversationTurn turn);

    List<ConversationTurn> findBySender(@Param("sender") String sender);

    /**
     * Newest first
     */
    List<ConversationTurn> findRecentBySender(@Param("sender") String sender, @Param("limit") int limit);

    int countBySender(@Param("sender") String sender);
}
