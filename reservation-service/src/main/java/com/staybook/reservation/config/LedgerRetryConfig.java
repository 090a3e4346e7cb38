package com.staybook.reservation.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policy for releasing cells after a failed compensating hold.
 */
@Configuration
public class LedgerRetryConfig {

    @Bean
    public RetryTemplate ledgerCompensationRetryTemplate(
            @Value("${stay.ledger.compensation.max-attempts:5}") int maxAttempts,
            @Value("${stay.ledger.compensation.initial-backoff-ms:50}") long initialBackoffMs,
            @Value("${stay.ledger.compensation.max-backoff-ms:2000}") long maxBackoffMs) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialBackoffMs, 2.0, maxBackoffMs)
                .retryOn(TransientDataAccessException.class)
                .retryOn(RecoverableDataAccessException.class)
                .traversingCauses()
                .build();
    }
}
