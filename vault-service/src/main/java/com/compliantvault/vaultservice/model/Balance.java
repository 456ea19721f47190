package com.compliantvault.vaultservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigInteger;
import java.time.Instant;

@Entity
@Table(name = "balances")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Balance {

    @Id
    @Column(nullable = false, updatable = false)
    private String principal;

    // uint256 range, never negative
    @Column(nullable = false, precision = 78, scale = 0)
    @Builder.Default
    private BigInteger amount = BigInteger.ZERO;

    @Version
    private Long version;

    @UpdateTimestamp
    private Instant updatedAt;
}
