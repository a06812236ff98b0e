package com.tenantbill.backend.repositories;

import com.tenantbill.backend.models.BillingEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface BillingEventRepository extends JpaRepository<BillingEvent, Long> {

    /**
     * Ledger lookup used for webhook deduplication
     */
    Optional<BillingEvent> findByIdempotencyKey(String idempotencyKey);
}
