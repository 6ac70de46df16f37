package com.replymail.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.replymail.ledger.JsonFileProcessedLedger;
import com.replymail.ledger.ProcessedLedger;
import com.replymail.ledger.SqliteProcessedLedger;
import com.replymail.mapper.ProcessedRecordMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import java.nio.file.Path;

/**
 * Processed ledger backend selection (replymail.ledger.store = sqlite | json)
 */
@Slf4j
@Configuration
public class LedgerConfig {

    @Bean(initMethod = "open", destroyMethod = "close")
    @DependsOn("dataSourceInitializer")
    public ProcessedLedger processedLedger(AssistantProperties properties,
                                           ProcessedRecordMapper mapper,
                                           ObjectMapper objectMapper) {
        String store = properties.getLedger().getStore();
        if ("json".equalsIgnoreCase(store)) {
            log.info("Processed ledger backend: json ({})", properties.getLedger().getJsonPath());
            return new JsonFileProcessedLedger(Path.of(properties.getLedger().getJsonPath()), objectMapper);
        }
        if (!"sqlite".equalsIgnoreCase(store)) {
            throw new IllegalStateException("Unknown ledger store: " + store);
        }
        log.info("Processed ledger backend: sqlite");
        return new SqliteProcessedLedger(mapper);
    }
}
