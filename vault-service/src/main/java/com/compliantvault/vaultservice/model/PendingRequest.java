package com.compliantvault.vaultservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigInteger;
import java.time.Instant;

@Entity
@Table(name = "pending_requests", indexes = {
        @Index(name = "idx_pending_kind", columnList = "kind"),
        @Index(name = "idx_pending_created", columnList = "created_at")
})
// Columns are not updatable: an entry is inserted once and deleted once
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingRequest {

    // Assigned by the oracle, never generated here
    @Id
    @Column(name = "request_id", nullable = false, updatable = false)
    private String requestId;

    @Column(nullable = false, updatable = false)
    private String requester;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger amount;

    @Column(nullable = false, updatable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private RequestKind kind;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
