package com.compliantvault.vaultservice.service;

import com.compliantvault.vaultservice.dto.event.VaultEvent;
import com.compliantvault.vaultservice.model.OutboxEvent;
import com.compliantvault.vaultservice.model.OutboxStatus;
import com.compliantvault.vaultservice.model.VaultEventType;
import com.compliantvault.vaultservice.repository.OutboxRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.serializer.support.SerializationFailedException;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Writes vault events to the outbox. Must be called inside the transaction that
 * performs the state change being reported.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VaultEventPublisher {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;

    public VaultEvent publish(VaultEventType type, String requestId, String principal, BigInteger amount, String reason) {
        VaultEvent event = new VaultEvent(
                UUID.randomUUID(),
                type,
                requestId,
                principal,
                amount,
                reason,
                Instant.now()
        );

        try {
            outboxRepository.save(OutboxEvent.builder()
                    .aggregateId(requestId)
                    .eventType(type)
                    .payload(objectMapper.writeValueAsString(event))
                    .status(OutboxStatus.PENDING)
                    .createdAt(event.timestamp())
                    .build());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} for request {}", type, requestId, e);
            throw new SerializationFailedException("Failed to serialize event", e);
        }

        log.debug("Recorded {} for request {}", type, requestId);
        return event;
    }
}
