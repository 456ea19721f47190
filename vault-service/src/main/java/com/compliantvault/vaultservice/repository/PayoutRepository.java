package com.compliantvault.vaultservice.repository;

import com.compliantvault.vaultservice.model.Payout;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PayoutRepository extends JpaRepository<Payout, UUID> {

    Optional<Payout> findByRequestId(String requestId);

    boolean existsByRequestId(String requestId);
}
