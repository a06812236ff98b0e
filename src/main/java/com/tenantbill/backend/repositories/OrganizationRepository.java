package com.tenantbill.backend.repositories;

import com.tenantbill.backend.models.Organization;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface OrganizationRepository extends JpaRepository<Organization, Long> {

    /**
     * Find organization by slug (tenant key carried in webhook metadata)
     */
    Optional<Organization> findBySlug(String slug);

    boolean existsBySlug(String slug);
}
