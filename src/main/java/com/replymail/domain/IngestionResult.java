package com.replymail.domain;

import java.util.List;

/**
 * Document id plus the chunk ids created for it
 */
public record IngestionResult(String documentId, List<String> chunkIds) {
}
