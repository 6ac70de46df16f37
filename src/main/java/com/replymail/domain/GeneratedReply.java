package com.replymail.domain;

/**
 * Reply text plus whether it came from the fallback path instead of the model
 */
public record GeneratedReply(String text, boolean fallback, int contextChunks) {
}
