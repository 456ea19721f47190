package com.compliantvault.vaultservice.scheduler;

import com.compliantvault.vaultservice.model.OutboxEvent;
import com.compliantvault.vaultservice.model.OutboxStatus;
import com.compliantvault.vaultservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPoller {

    private static final int BATCH_SIZE = 200;

    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, String> stringKafkaTemplate;

    @Scheduled(fixedDelay = 100)
    @Transactional
    public void processOutboxEvents() {
        List<OutboxEvent> events = outboxRepository.findByStatusOrderByCreatedAt(OutboxStatus.PENDING, PageRequest.of(0, BATCH_SIZE));

        if (events.isEmpty()) return;

        for (OutboxEvent event : events) {
            String topic = event.getEventType().getTopic();
            try {
                stringKafkaTemplate.send(topic, event.getAggregateId(), event.getPayload())
                        .get(3, TimeUnit.SECONDS);

                event.setStatus(OutboxStatus.PROCESSED);
                outboxRepository.save(event);

                log.debug("Published {} for request {} to {}", event.getEventType(), event.getAggregateId(), topic);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Interrupted while publishing outbox event {}", event.getId());
                return;
            } catch (ExecutionException | TimeoutException e) {
                log.error("Failed to publish outbox event {} to {}", event.getId(), topic, e);
                return;
            }
        }
    }
}
