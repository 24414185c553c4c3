package com.seatwatch.monitor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

@Configuration
public class MonitorConfiguration {

    public static final String REQUIRES_NEW_TRANSACTION = "requiresNewTransactionTemplate";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs each insert attempt in its own transaction so a unique-key conflict rolls back only that attempt.
     */
    @Bean(name = REQUIRES_NEW_TRANSACTION)
    public TransactionTemplate requiresNewTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        return template;
    }
}
