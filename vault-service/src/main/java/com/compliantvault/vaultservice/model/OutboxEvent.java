package com.compliantvault.vaultservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Data
@Builder
@Table(name = "outbox_events", indexes = {
        @Index(name = "idx_outbox_status", columnList = "status, created_at")
})
@AllArgsConstructor
@NoArgsConstructor
public class OutboxEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // The requestId the event is about
    @Column(nullable = false)
    private String aggregateId;

    @Column(nullable = false, length = 40)
    @Enumerated(EnumType.STRING)
    private VaultEventType eventType;

    @Column(nullable = false, length = 4000)
    private String payload;

    @Column(nullable = false)
    @Enumerated(EnumType.STRING)
    private OutboxStatus status;

    @Column(nullable = false)
    private Instant createdAt;
}
