package com.replymail.domain;

import lombok.Builder;

import java.util.List;

/**
 * Document or article handed to the retrieval index for ingestion
 */
@Builder
public record KnowledgeDocument(
        String documentId,
        String title,
        String content,
        String source,
        String url,
        List<String> topics) {

    public KnowledgeDocument {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
