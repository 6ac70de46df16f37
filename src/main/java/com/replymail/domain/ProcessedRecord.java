package com.replymail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Processed ledger entry: message key -> processed timestamp (ISO-8601)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedRecord {

    private String messageId;
    private String processedAt;
}
