package com.flagship.member_ledger.lastschrift;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface LastschriftTransactionRepository extends JpaRepository<LastschriftTransactionEntity, Long> {

    List<LastschriftTransactionEntity> findByMandateIdOrderByIdDesc(Long mandateId);

    List<LastschriftTransactionEntity> findByStatusOrderByIdAsc(TransactionStatus status);

    List<LastschriftTransactionEntity> findByMandateIdAndStatus(Long mandateId, TransactionStatus status);

    boolean existsByMandateId(Long mandateId);

    boolean existsByMandateIdAndStatus(Long mandateId, TransactionStatus status);

    /**
     * Whether the mandate has a transaction in one of the given statuses in a period
     * from {@code firstPeriodId} on.
     */
    @Query("SELECT CASE WHEN COUNT(t) > 0 THEN true ELSE false END FROM LastschriftTransactionEntity t " +
           "WHERE t.mandateId = :mandateId AND t.status IN :statuses AND t.periodId >= :firstPeriodId")
    boolean existsSincePeriod(@Param("mandateId") Long mandateId,
                              @Param("statuses") Collection<TransactionStatus> statuses,
                              @Param("firstPeriodId") Integer firstPeriodId);

    /**
     * Mandates, among the given ones, that have been collected successfully at least
     * once. A first collection is announced to the bank as FRST, later ones as RCUR.
     */
    @Query("SELECT DISTINCT t.mandateId FROM LastschriftTransactionEntity t " +
           "WHERE t.mandateId IN :mandateIds AND t.status IN :statuses")
    List<Long> findMandatesWithStatus(@Param("mandateIds") Collection<Long> mandateIds,
                                      @Param("statuses") Collection<TransactionStatus> statuses);
}
