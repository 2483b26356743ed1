package dev.issuehook.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction used by the event handler around each reconciliation.
 *
 * <p>The lookup takes a row lock, so the timeout also bounds how long an event
 * waits behind another event for the same issue.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    public TransactionTemplate reconcileTransaction(PlatformTransactionManager transactionManager,
                                                    PersistenceProperties properties) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setTimeout((int) Math.max(1, properties.timeout().toSeconds()));
        return template;
    }
}
