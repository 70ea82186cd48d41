package com.flagship.member_ledger.fee;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FeeDefinitionRepository extends JpaRepository<FeeDefinitionEntity, Long> {

    List<FeeDefinitionEntity> findByEventIdOrderByIdAsc(Long eventId);

    Optional<FeeDefinitionEntity> findByIdAndEventId(Long id, Long eventId);
}
