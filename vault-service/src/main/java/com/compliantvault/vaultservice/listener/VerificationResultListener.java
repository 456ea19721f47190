package com.compliantvault.vaultservice.listener;

import com.compliantvault.vaultservice.dto.OracleCallback;
import com.compliantvault.vaultservice.dto.ReconciliationResult;
import com.compliantvault.vaultservice.service.reconciliation.Reconciler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Oracle results relayed over Kafka. Same payload as the HTTP callback.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VerificationResultListener {

    private final Reconciler reconciler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
            topics = "${app.kafka.verification-topic}",
            groupId = "${spring.kafka.consumer.group-id}"
    )
    public void handleVerificationResult(String message, Acknowledgment acknowledgment) {
        OracleCallback callback;
        try {
            callback = objectMapper.readValue(message, OracleCallback.class);
        } catch (JsonProcessingException e) {
            // Redelivery will not make it parseable
            log.error("Dropping undecodable verification result: {}", message, e);
            acknowledgment.acknowledge();
            return;
        }

        if (callback.requestId() == null || callback.requestId().isBlank()) {
            log.error("Dropping verification result without request id: {}", message);
            acknowledgment.acknowledge();
            return;
        }

        ReconciliationResult result = reconciler.onOutcome(callback.requestId(), callback.response(), callback.error());
        log.info("Verification result for {} reconciled as {}", result.requestId(), result.outcome());

        acknowledgment.acknowledge();
    }
}
