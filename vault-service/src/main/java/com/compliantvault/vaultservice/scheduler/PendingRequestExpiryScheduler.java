package com.compliantvault.vaultservice.scheduler;

import com.compliantvault.vaultservice.service.reconciliation.Reconciler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Optional. Without it a request the oracle never answers stays pending forever.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "app.vault.expiry.enabled", havingValue = "true")
public class PendingRequestExpiryScheduler {

    private final Reconciler reconciler;
    private final Duration ttl;
    private final int batchSize;

    public PendingRequestExpiryScheduler(Reconciler reconciler,
                                         @Value("${app.vault.expiry.ttl}") Duration ttl,
                                         @Value("${app.vault.expiry.batch-size:100}") int batchSize) {
        this.reconciler = reconciler;
        this.ttl = ttl;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${app.vault.expiry.sweep-interval:60000}")
    public void expireStaleRequests() {
        int expired = reconciler.expireCreatedBefore(Instant.now().minus(ttl), batchSize);

        if (expired > 0) {
            log.warn("Expired {} pending requests older than {}", expired, ttl);
        }
    }
}
