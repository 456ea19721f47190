package com.compliantvault.vaultservice.repository;

import com.compliantvault.vaultservice.model.OutboxEvent;
import com.compliantvault.vaultservice.model.OutboxStatus;
import com.compliantvault.vaultservice.model.VaultEventType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OutboxRepository extends JpaRepository<OutboxEvent, UUID> {

    List<OutboxEvent> findByStatusOrderByCreatedAt(OutboxStatus status, Pageable page);

    List<OutboxEvent> findAllByAggregateIdOrderByCreatedAt(String aggregateId);

    long countByEventType(VaultEventType eventType);
}
