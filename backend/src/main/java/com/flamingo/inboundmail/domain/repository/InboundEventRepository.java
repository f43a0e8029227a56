package com.flamingo.inboundmail.domain.repository;

import com.flamingo.inboundmail.domain.entity.InboundEvent;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for InboundEvent entities. */
@Repository
public interface InboundEventRepository extends JpaRepository<InboundEvent, UUID> {

  Optional<InboundEvent> findByProviderIdAndExternalEventId(
      String providerId, String externalEventId);

  long countByProviderIdAndExternalEventId(String providerId, String externalEventId);
}
