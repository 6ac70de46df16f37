package com.replymail.domain;

/**
 * Search hit: chunk plus cosine relevance score
 */
public record ScoredChunk(DocumentChunk chunk, double score) {
}
