package com.compliantvault.vaultservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * What every dispatch carries to the oracle besides its arguments. Single row.
 */
@Entity
@Table(name = "oracle_settings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OracleSettings {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(nullable = false)
    private String owner;

    @Column(nullable = false, length = 20000)
    private String source;

    @Column(length = 4000)
    private String encryptedSecrets;

    @Column(nullable = false)
    private Long subscriptionId;

    @Column(nullable = false)
    private String donId;

    @Column(nullable = false)
    private Integer gasLimit;

    @UpdateTimestamp
    private Instant updatedAt;
}
