package com.replymail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.List;

/**
 * Retrieval index chunk entity
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DocumentChunk {

    private String chunkId;
    private String documentId;
    private int chunkIndex;
    private String content;
    private float[] embedding;
    private String title;
    private String source;      // user_document, news_article, pdf_document
    private String url;
    private String topics;      // comma separated
    private String ingestedAt;  // ISO-8601

    /**
     * Detached copy; index entries are never handed out directly
     */
    public DocumentChunk copy() {
        return toBuilder()
                .embedding(embedding == null ? null : embedding.clone())
                .build();
    }

    public List<String> topicList() {
        if (topics == null || topics.isBlank()) {
            return List.of();
        }
        return Arrays.stream(topics.split(","))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .toList();
    }
}
