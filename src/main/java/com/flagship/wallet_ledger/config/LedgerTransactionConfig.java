package com.flagship.wallet_ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * The atomic unit of work used for every ledger mutation.
 *
 * The template is opened explicitly by the transaction coordinator; every
 * read, lock and write of a transfer runs on the connection it binds, and the
 * unit ends in commit or rollback on every exit path. The timeout bounds how
 * long a unit may hold wallet locks.
 */
@Configuration
public class LedgerTransactionConfig {

    @Bean
    public TransactionTemplate ledgerTransactionTemplate(
            PlatformTransactionManager transactionManager,
            @Value("${ledger.transaction.timeout:10}") int timeoutSeconds) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setName("ledger-transfer");
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setTimeout(timeoutSeconds);
        return template;
    }
}
