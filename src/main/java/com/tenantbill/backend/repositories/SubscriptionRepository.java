package com.tenantbill.backend.repositories;

import com.tenantbill.backend.models.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for subscriptions. There is at most one row per organization.
 */
@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    Optional<Subscription> findByOrganization_Id(Long organizationId);
}
