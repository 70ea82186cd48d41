package com.flagship.member_ledger.ledger;

import com.flagship.member_ledger.observability.CorrelationContext;
import com.flagship.member_ledger.observability.FinanceMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * The single entry point for persona balances, membership flags and the finance log.
 *
 * Enforced here:
 * 1. Every balance mutation appends exactly one finance log entry whose new_balance
 *    equals the persisted balance, in the same transaction
 * 2. A balance never becomes negative (also a CHECK constraint)
 * 3. Mutations of one persona serialize on its row lock (SELECT ... FOR UPDATE) and
 *    bump its version
 * 4. The finance log is append-only (a trigger rejects UPDATE and DELETE)
 *
 * JDBC instead of JPA: the locking and the RETURNING inserts should be visible in the
 * code, not hidden behind a persistence context.
 */
@Service
@Slf4j
public class LedgerService {

    private final JdbcTemplate jdbcTemplate;
    private final FinanceMetrics financeMetrics;

    public LedgerService(JdbcTemplate jdbcTemplate, FinanceMetrics financeMetrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.financeMetrics = financeMetrics;
    }

    /**
     * Changes a balance by {@code delta} and logs it.
     *
     * @throws IllegalArgumentException    if delta is null or zero, or the persona is unknown
     * @throws LedgerConsistencyException if the balance would become negative
     */
    @Transactional
    public LedgerUpdate applyDelta(Long personaId, BigDecimal delta, FinanceLogCode code,
                                   FinanceActor actor, LocalDate transactionDate, String note) {
        if (delta == null || delta.signum() == 0) {
            throw new IllegalArgumentException("Balance change must not be zero");
        }
        MDC.put(CorrelationContext.PERSONA_ID_MDC_KEY, personaId.toString());
        try {
            Persona before = lockPersona(personaId);
            BigDecimal newBalance = before.getBalance().add(delta).setScale(2, RoundingMode.UNNECESSARY);
            return writeBalance(before, newBalance, code, actor, transactionDate, note);
        } finally {
            MDC.remove(CorrelationContext.PERSONA_ID_MDC_KEY);
        }
    }

    /**
     * Sets a balance to an absolute value and logs the difference.
     *
     * @return empty if the balance already had that value (nothing is logged then)
     * @throws IllegalArgumentException if the new balance is negative
     */
    @Transactional
    public Optional<LedgerUpdate> setBalance(Long personaId, BigDecimal newBalance, FinanceLogCode code,
                                             FinanceActor actor, String note) {
        if (newBalance == null || newBalance.signum() < 0) {
            throw new IllegalArgumentException("Balance must be non-negative: " + newBalance);
        }
        Persona before = lockPersona(personaId);
        BigDecimal target = newBalance.setScale(2, RoundingMode.UNNECESSARY);
        if (before.getBalance().compareTo(target) == 0) {
            log.debug("Balance unchanged, nothing to log: personaId={}", personaId);
            return Optional.empty();
        }
        return Optional.of(writeBalance(before, target, code, actor, null, note));
    }

    /**
     * Changes the membership flags of a persona and logs a status entry (no delta).
     */
    @Transactional
    public LedgerUpdate updateMembership(Long personaId, boolean member, boolean trialMember,
                                         FinanceLogCode code, FinanceActor actor, String note) {
        Persona before = lockPersona(personaId);
        int updated = jdbcTemplate.update(
            "UPDATE personas SET is_member = ?, trial_member = ?, version = version + 1 " +
            "WHERE id = ? AND version = ?",
            member, trialMember, personaId, before.getVersion());
        requireSingleRow(updated, personaId);

        FinanceLogEntry entry = appendLog(code, actor, personaId, null, null, null, note);
        Persona after = requirePersona(personaId);
        log.info("Membership changed: personaId={}, code={}, member={}, trialMember={}",
                personaId, code, member, trialMember);
        return new LedgerUpdate(before, after, entry);
    }

    /**
     * Archives a persona. The remaining balance is removed and logged.
     */
    @Transactional
    public LedgerUpdate archive(Long personaId, FinanceActor actor, String note) {
        Persona before = lockPersona(personaId);
        if (before.isArchived()) {
            throw new IllegalStateException("Persona " + personaId + " is already archived");
        }
        int updated = jdbcTemplate.update(
            "UPDATE personas SET balance = 0, is_member = FALSE, trial_member = FALSE, is_archived = TRUE, " +
            "version = version + 1 WHERE id = ? AND version = ?",
            personaId, before.getVersion());
        requireSingleRow(updated, personaId);

        BigDecimal zero = BigDecimal.ZERO.setScale(2);
        FinanceLogEntry entry = appendLog(FinanceLogCode.REMOVE_BALANCE_ON_ARCHIVAL, actor, personaId,
            before.getBalance().negate(), zero, null, note);
        Persona after = requirePersona(personaId);
        assertMatches(after, entry);
        return new LedgerUpdate(before, after, entry);
    }

    /**
     * Appends a finance log entry within the caller's transaction.
     *
     * Used directly only for entries that do not touch a balance (mandate and
     * transaction status changes). Balance changes go through {@link #applyDelta}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public FinanceLogEntry appendLog(FinanceLogCode code, FinanceActor actor, Long personaId,
                                     BigDecimal delta, BigDecimal newBalance,
                                     LocalDate transactionDate, String note) {
        FinanceLogEntry entry = jdbcTemplate.queryForObject(
            "WITH totals AS (" +
            "  SELECT COUNT(*) FILTER (WHERE is_member) AS members, " +
            "         COALESCE(SUM(balance), 0) AS total, " +
            "         COALESCE(SUM(balance) FILTER (WHERE is_member), 0) AS member_total " +
            "  FROM personas) " +
            "INSERT INTO finance_log (code, submitted_by, persona_id, delta, new_balance, transaction_date, " +
            "                         change_note, members, total, member_total) " +
            "SELECT ?::varchar, ?::bigint, ?::bigint, ?::numeric, ?::numeric, ?::date, ?::text, " +
            "       totals.members, totals.total, totals.member_total FROM totals " +
            "RETURNING *",
            financeLogRowMapper(),
            code.name(),
            actor.getPersonaId(),
            personaId,
            delta,
            newBalance,
            transactionDate != null ? Date.valueOf(transactionDate) : null,
            note
        );
        financeMetrics.recordFinanceLogEntry(code.name());
        return entry;
    }

    /**
     * Locks the persona row for the rest of the transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Persona lockPersona(Long personaId) {
        List<Persona> personas = jdbcTemplate.query(
            "SELECT * FROM personas WHERE id = ? FOR UPDATE", personaRowMapper(), personaId);
        if (personas.isEmpty()) {
            throw new IllegalArgumentException("Persona not found: " + personaId);
        }
        return personas.get(0);
    }

    @Transactional(readOnly = true)
    public Optional<Persona> findPersona(Long personaId) {
        return jdbcTemplate.query("SELECT * FROM personas WHERE id = ?", personaRowMapper(), personaId)
            .stream().findFirst();
    }

    /**
     * Checks that a persona's balance equals the new_balance of its latest balance
     * entry (or zero when it has none).
     */
    @Transactional(readOnly = true)
    public boolean verifyConsistency(Long personaId) {
        Persona persona = requirePersona(personaId);
        List<BigDecimal> latest = jdbcTemplate.queryForList(
            "SELECT new_balance FROM finance_log WHERE persona_id = ? AND new_balance IS NOT NULL " +
            "ORDER BY id DESC LIMIT 1",
            BigDecimal.class, personaId);
        BigDecimal expected = latest.isEmpty() ? BigDecimal.ZERO : latest.get(0);
        return persona.getBalance().compareTo(expected) == 0;
    }

    /**
     * Sum of all logged deltas of a persona. Equals the balance for personas created
     * with a zero balance.
     */
    @Transactional(readOnly = true)
    public BigDecimal sumOfDeltas(Long personaId) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(delta), 0) FROM finance_log WHERE persona_id = ?",
            BigDecimal.class, personaId);
    }

    /**
     * When the persona's latest entry with {@code code} was logged.
     */
    @Transactional(readOnly = true)
    public Optional<Instant> lastLoggedAt(Long personaId, FinanceLogCode code) {
        Timestamp ctime = jdbcTemplate.queryForObject(
            "SELECT MAX(ctime) FROM finance_log WHERE persona_id = ? AND code = ?",
            Timestamp.class, personaId, code.name());
        return Optional.ofNullable(ctime).map(Timestamp::toInstant);
    }

    /**
     * Number of personas whose balance disagrees with the log. Zero in a healthy system.
     */
    @Transactional(readOnly = true)
    public long countInconsistentPersonas() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM personas p WHERE p.balance <> COALESCE((" +
            "  SELECT f.new_balance FROM finance_log f " +
            "  WHERE f.persona_id = p.id AND f.new_balance IS NOT NULL ORDER BY f.id DESC LIMIT 1), 0)",
            Long.class);
        return count != null ? count : 0L;
    }

    private LedgerUpdate writeBalance(Persona before, BigDecimal newBalance, FinanceLogCode code,
                                      FinanceActor actor, LocalDate transactionDate, String note) {
        if (newBalance.signum() < 0) {
            throw new LedgerConsistencyException(String.format(
                "Balance of persona %d would become negative: %s", before.getId(), newBalance.toPlainString()));
        }
        int updated = jdbcTemplate.update(
            "UPDATE personas SET balance = ?, version = version + 1 WHERE id = ? AND version = ?",
            newBalance, before.getId(), before.getVersion());
        requireSingleRow(updated, before.getId());

        BigDecimal delta = newBalance.subtract(before.getBalance());
        FinanceLogEntry entry = appendLog(code, actor, before.getId(), delta, newBalance, transactionDate, note);
        Persona after = requirePersona(before.getId());
        assertMatches(after, entry);
        financeMetrics.recordBalanceChange(code.name(), delta);

        log.info("Balance changed: personaId={}, code={}, delta={}, newBalance={}",
                before.getId(), code, delta, newBalance);
        return new LedgerUpdate(before, after, entry);
    }

    private void assertMatches(Persona persona, FinanceLogEntry entry) {
        if (entry.getNewBalance() == null || persona.getBalance().compareTo(entry.getNewBalance()) != 0) {
            log.error("Ledger mismatch: personaId={}, balance={}, loggedBalance={}",
                    persona.getId(), persona.getBalance(), entry.getNewBalance());
            throw new LedgerConsistencyException(String.format(
                "Balance %s of persona %d does not match finance log entry %d",
                persona.getBalance(), persona.getId(), entry.getId()));
        }
    }

    private void requireSingleRow(int updated, Long personaId) {
        // the row is locked, so a version miss means someone bypassed the lock
        if (updated != 1) {
            throw new LedgerConsistencyException("Concurrent modification of persona " + personaId);
        }
    }

    private Persona requirePersona(Long personaId) {
        return jdbcTemplate.query("SELECT * FROM personas WHERE id = ?", personaRowMapper(), personaId)
            .stream().findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Persona not found: " + personaId));
    }

    static RowMapper<Persona> personaRowMapper() {
        return (rs, rowNum) -> new Persona(
            rs.getLong("id"),
            rs.getString("given_names"),
            rs.getString("family_name"),
            rs.getBigDecimal("balance"),
            rs.getBoolean("is_member"),
            rs.getBoolean("trial_member"),
            rs.getBoolean("is_archived"),
            rs.getLong("version")
        );
    }

    static RowMapper<FinanceLogEntry> financeLogRowMapper() {
        return (rs, rowNum) -> {
            Date transactionDate = rs.getDate("transaction_date");
            long submittedBy = rs.getLong("submitted_by");
            boolean noSubmitter = rs.wasNull();
            long personaId = rs.getLong("persona_id");
            boolean noPersona = rs.wasNull();
            return new FinanceLogEntry(
                rs.getLong("id"),
                rs.getTimestamp("ctime").toInstant(),
                FinanceLogCode.valueOf(rs.getString("code")),
                noSubmitter ? null : submittedBy,
                noPersona ? null : personaId,
                rs.getBigDecimal("delta"),
                rs.getBigDecimal("new_balance"),
                transactionDate != null ? transactionDate.toLocalDate() : null,
                rs.getString("change_note"),
                rs.getInt("members"),
                rs.getBigDecimal("total"),
                rs.getBigDecimal("member_total")
            );
        };
    }
}
