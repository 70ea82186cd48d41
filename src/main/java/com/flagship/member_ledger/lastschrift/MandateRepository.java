package com.flagship.member_ledger.lastschrift;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MandateRepository extends JpaRepository<MandateEntity, Long> {

    boolean existsByPersonaIdAndRevokedAtIsNull(Long personaId);

    Optional<MandateEntity> findByPersonaIdAndRevokedAtIsNull(Long personaId);

    List<MandateEntity> findByPersonaIdOrderByGrantedAtDesc(Long personaId);

    List<MandateEntity> findByRevokedAtIsNullOrderByIdAsc();

    List<MandateEntity> findAllByOrderByIdAsc();

    /**
     * Row lock for status changes, so a revocation and a transaction issue on the
     * same mandate serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM MandateEntity m WHERE m.id = :id")
    Optional<MandateEntity> findByIdForUpdate(@Param("id") Long id);
}
