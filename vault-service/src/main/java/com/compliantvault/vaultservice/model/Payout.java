package com.compliantvault.vaultservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "payouts", indexes = {
        @Index(name = "idx_payout_recipient", columnList = "recipient")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payout {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // One payout per request at most
    @Column(name = "request_id", nullable = false, unique = true, updatable = false)
    private String requestId;

    @Column(nullable = false, updatable = false)
    private String recipient;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigInteger amount;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private PayoutReason reason;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;
}
