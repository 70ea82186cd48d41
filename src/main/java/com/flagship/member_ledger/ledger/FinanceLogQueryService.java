package com.flagship.member_ledger.ledger;

import com.flagship.member_ledger.config.FinanceProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the finance log and the finance statistics.
 */
@Service
@RequiredArgsConstructor
public class FinanceLogQueryService {

    static final int MAX_PAGE_SIZE = 500;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final FinanceProperties financeProperties;

    @Transactional(readOnly = true)
    public FinanceLogPage find(FinanceLogFilter filter) {
        if (filter.getOffset() < 0) {
            throw new IllegalArgumentException("Offset must not be negative");
        }
        if (filter.getLimit() < 1 || filter.getLimit() > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (filter.getFrom() != null && filter.getTo() != null && filter.getFrom().isAfter(filter.getTo())) {
            throw new IllegalArgumentException("Start date must not be after end date");
        }

        StringBuilder where = new StringBuilder(" WHERE TRUE");
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (filter.getCodes() != null && !filter.getCodes().isEmpty()) {
            where.append(" AND code IN (:codes)");
            params.addValue("codes", filter.getCodes().stream().map(Enum::name).toList());
        }
        if (filter.getPersonaId() != null) {
            where.append(" AND persona_id = :personaId");
            params.addValue("personaId", filter.getPersonaId());
        }
        if (filter.getFrom() != null) {
            where.append(" AND ctime >= :from");
            params.addValue("from", Date.valueOf(filter.getFrom()));
        }
        if (filter.getTo() != null) {
            where.append(" AND ctime < :toExclusive");
            params.addValue("toExclusive", Date.valueOf(filter.getTo().plusDays(1)));
        }

        Long total = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM finance_log" + where, params, Long.class);

        params.addValue("limit", filter.getLimit());
        params.addValue("offset", filter.getOffset());
        List<FinanceLogEntry> entries = jdbcTemplate.query(
            "SELECT * FROM finance_log" + where + " ORDER BY id ASC LIMIT :limit OFFSET :offset",
            params, LedgerService.financeLogRowMapper());

        return new FinanceLogPage(total != null ? total : 0L, filter.getOffset(), filter.getLimit(), entries);
    }

    @Transactional(readOnly = true)
    public Optional<FinanceLogEntry> findEntry(Long id) {
        return jdbcTemplate.query("SELECT * FROM finance_log WHERE id = :id", Map.of("id", id),
            LedgerService.financeLogRowMapper()).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public FinanceStatistics computeStatistics() {
        BigDecimal fee = financeProperties.getMembershipFee();
        return jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FILTER (WHERE p.is_member) AS members, " +
            "       COUNT(*) FILTER (WHERE p.is_member AND p.trial_member) AS trial_members, " +
            "       COALESCE(SUM(p.balance) FILTER (WHERE p.is_member), 0) AS member_total, " +
            "       COUNT(*) FILTER (WHERE p.is_member AND NOT p.trial_member AND p.balance < :fee) AS low, " +
            "       COALESCE(SUM(p.balance) FILTER (WHERE p.is_member AND NOT p.trial_member AND p.balance < :fee), 0) AS low_total, " +
            "       COUNT(*) FILTER (WHERE p.is_member AND NOT p.trial_member AND p.balance < :fee AND EXISTS (" +
            "           SELECT 1 FROM lastschrift_mandates m WHERE m.persona_id = p.id AND m.revoked_at IS NULL)) AS low_with_mandate " +
            "FROM personas p WHERE NOT p.is_archived",
            Map.of("fee", fee),
            (rs, rowNum) -> new FinanceStatistics(
                rs.getLong("members"),
                rs.getLong("trial_members"),
                rs.getBigDecimal("member_total"),
                rs.getLong("low"),
                rs.getBigDecimal("low_total"),
                rs.getLong("low_with_mandate")
            ));
    }
}
