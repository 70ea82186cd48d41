package com.flagship.member_ledger.membership;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
public class PeriodRepository {

    private final JdbcTemplate jdbcTemplate;

    public PeriodRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Period findCurrent() {
        return jdbcTemplate.query("SELECT * FROM org_periods ORDER BY id DESC LIMIT 1", periodRowMapper())
            .stream().findFirst()
            .orElseThrow(() -> new IllegalStateException("No billing period configured"));
    }

    /**
     * Current period, locked until the end of the transaction. Serializes balance
     * update steps and period advancement.
     */
    public Period lockCurrent() {
        return jdbcTemplate.query("SELECT * FROM org_periods ORDER BY id DESC LIMIT 1 FOR UPDATE", periodRowMapper())
            .stream().findFirst()
            .orElseThrow(() -> new IllegalStateException("No billing period configured"));
    }

    public Optional<Period> findById(int id) {
        return jdbcTemplate.query("SELECT * FROM org_periods WHERE id = ?", periodRowMapper(), id)
            .stream().findFirst();
    }

    public void saveProgress(Period period) {
        jdbcTemplate.update(
            "UPDATE org_periods SET balance_state = ?, balance_trial_members = ?, balance_deducted_members = ?, " +
            "balance_deferred_members = ?, balance_lapsed_members = ?, balance_total = ? WHERE id = ?",
            period.getBalanceState(),
            period.getBalanceTrialMembers(),
            period.getBalanceDeductedMembers(),
            period.getBalanceDeferredMembers(),
            period.getBalanceLapsedMembers(),
            period.getBalanceTotal(),
            period.getId());
    }

    public void markBalanceDone(int id) {
        jdbcTemplate.update("UPDATE org_periods SET balance_done = now() WHERE id = ?", id);
    }

    public void saveArchivalProgress(Period period) {
        jdbcTemplate.update("UPDATE org_periods SET archival_state = ?, archival_count = ? WHERE id = ?",
            period.getArchivalState(), period.getArchivalCount(), period.getId());
    }

    public void markArchivalDone(int id) {
        jdbcTemplate.update("UPDATE org_periods SET archival_done = now() WHERE id = ?", id);
    }

    public Period createNext(Period current) {
        jdbcTemplate.update("INSERT INTO org_periods (id) VALUES (?)", current.getId() + 1);
        return findById(current.getId() + 1)
            .orElseThrow(() -> new IllegalStateException("Period " + (current.getId() + 1) + " was not created"));
    }

    /**
     * Id of the next member after {@code afterPersonaId} in id order.
     */
    public Optional<Long> findNextMember(Long afterPersonaId) {
        List<Long> ids = jdbcTemplate.queryForList(
            "SELECT id FROM personas WHERE is_member AND NOT is_archived AND id > ? ORDER BY id LIMIT 1",
            Long.class, afterPersonaId != null ? afterPersonaId : 0L);
        return ids.stream().findFirst();
    }

    /**
     * Id of the next non-member after {@code afterPersonaId} that is not archived yet.
     */
    public Optional<Long> findNextArchivalCandidate(Long afterPersonaId) {
        List<Long> ids = jdbcTemplate.queryForList(
            "SELECT id FROM personas WHERE NOT is_member AND NOT is_archived AND id > ? ORDER BY id LIMIT 1",
            Long.class, afterPersonaId != null ? afterPersonaId : 0L);
        return ids.stream().findFirst();
    }

    private static RowMapper<Period> periodRowMapper() {
        return (rs, rowNum) -> {
            long state = rs.getLong("balance_state");
            boolean noState = rs.wasNull();
            Timestamp done = rs.getTimestamp("balance_done");
            long archivalState = rs.getLong("archival_state");
            boolean noArchivalState = rs.wasNull();
            Timestamp archivalDone = rs.getTimestamp("archival_done");
            return new Period(
                rs.getInt("id"),
                noState ? null : state,
                done != null ? done.toInstant() : null,
                rs.getInt("balance_trial_members"),
                rs.getInt("balance_deducted_members"),
                rs.getInt("balance_deferred_members"),
                rs.getInt("balance_lapsed_members"),
                rs.getBigDecimal("balance_total"),
                noArchivalState ? null : archivalState,
                archivalDone != null ? archivalDone.toInstant() : null,
                rs.getInt("archival_count")
            );
        };
    }
}
