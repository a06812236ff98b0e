package com.tenantbill.backend.repositories;

import com.tenantbill.backend.models.ApiToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ApiTokenRepository extends JpaRepository<ApiToken, Long> {

    /**
     * Find a non-revoked token by hash, fetching its user and organization for the request context
     */
    @Query("SELECT t FROM ApiToken t JOIN FETCH t.user u JOIN FETCH u.organization " +
            "WHERE t.tokenHash = :tokenHash AND t.revokedAt IS NULL")
    Optional<ApiToken> findActiveByTokenHash(@Param("tokenHash") String tokenHash);
}
