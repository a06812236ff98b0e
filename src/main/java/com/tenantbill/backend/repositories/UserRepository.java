package com.tenantbill.backend.repositories;

import com.tenantbill.backend.models.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    List<User> findByOrganizationIdOrderByIdAsc(Long organizationId);

    long countByOrganizationId(Long organizationId);

    boolean existsByOrganizationIdAndEmail(Long organizationId, String email);
}
