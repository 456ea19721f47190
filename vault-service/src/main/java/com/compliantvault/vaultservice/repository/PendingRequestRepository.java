package com.compliantvault.vaultservice.repository;

import com.compliantvault.vaultservice.model.PendingRequest;
import com.compliantvault.vaultservice.model.RequestKind;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

@Repository
public interface PendingRequestRepository extends JpaRepository<PendingRequest, String> {

    @Query("select sum(p.amount) from PendingRequest p where p.kind = :kind")
    BigInteger sumAmountByKind(@Param("kind") RequestKind kind);

    List<PendingRequest> findByCreatedAtBeforeOrderByCreatedAt(Instant threshold, Pageable page);
}
