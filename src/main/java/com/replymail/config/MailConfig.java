package com.replymail.config;

import com.replymail.mail.JakartaMailTransport;
import com.replymail.mail.MailTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Mailbox transport configuration
 */
@Slf4j
@Configuration
public class MailConfig {

    @Bean(destroyMethod = "disconnect")
    public MailTransport mailTransport(AssistantProperties properties) {
        AssistantProperties.Mail mail = properties.getMail();
        if (mail.getUsername() == null || mail.getUsername().isBlank()) {
            log.warn("replymail.mail.username is empty - polling will fail until credentials are configured");
        }
        log.info("Mail transport configured: imap={}:{} smtp={}:{} folder={}",
                mail.getImapHost(), mail.getImapPort(), mail.getSmtpHost(), mail.getSmtpPort(), mail.getFolder());
        return new JakartaMailTransport(mail);
    }
}
