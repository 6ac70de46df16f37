package com.replymail;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * ReplyMail mailbox assistant
 *
 * Watches a mailbox and answers each unread message
 * - Jakarta Mail IMAP polling + SMTP submission
 * - Idempotent processed-message ledger (MyBatis + SQLite or JSON file)
 * - Retrieval index over ingested documents (langchain4j embeddings)
 * - langchain4j chat model for evaluation and reply generation
 * - Reactor bounded retry/timeout around every external call
 * - Prometheus metrics monitoring
 */
@SpringBootApplication
@MapperScan("com.replymail.mapper")
@EnableConfigurationProperties
public class ReplyMailApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReplyMailApplication.class, args);
    }
}
