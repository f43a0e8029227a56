package com.flamingo.inboundmail.domain.repository;

import com.flamingo.inboundmail.domain.entity.Organization;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Organization entities. */
@Repository
public interface OrganizationRepository extends JpaRepository<Organization, UUID> {

  /** Finds organizations whose secrets may verify webhooks. */
  List<Organization> findByActiveTrue();

  boolean existsByName(String name);

  List<Organization> findAllByOrderByCreatedAtAsc();
}
