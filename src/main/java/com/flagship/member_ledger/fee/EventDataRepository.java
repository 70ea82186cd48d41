package com.flagship.member_ledger.fee;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC access to the event and registration tables.
 *
 * Those tables belong to the event subsystem. The only columns written here are the
 * derived payment columns of a registration.
 */
@Repository
@RequiredArgsConstructor
public class EventDataRepository {

    private static final TypeReference<Map<String, Object>> FIELD_MAP = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public Optional<EventSnapshot> findEvent(Long eventId) {
        List<EventSnapshot> events = jdbcTemplate.query(
            "SELECT id, title, is_locked, is_archived FROM events WHERE id = ?",
            (rs, rowNum) -> new EventSnapshot(
                rs.getLong("id"),
                rs.getString("title"),
                rs.getBoolean("is_locked"),
                rs.getBoolean("is_archived"),
                Set.copyOf(jdbcTemplate.queryForList(
                    "SELECT shortname FROM event_parts WHERE event_id = ?", String.class, eventId)),
                Set.copyOf(jdbcTemplate.queryForList(
                    "SELECT field_name FROM event_fields WHERE event_id = ?", String.class, eventId)),
                Set.copyOf(jdbcTemplate.queryForList(
                    "SELECT persona_id FROM event_orgas WHERE event_id = ?", Long.class, eventId))
            ),
            eventId
        );
        return events.stream().findFirst();
    }

    public List<RegistrationSnapshot> findRegistrations(Long eventId) {
        Map<Long, Map<String, RegistrationPartStatus>> parts = loadPartStatuses(
            "SELECT rp.registration_id, ep.shortname, rp.status FROM registration_parts rp " +
            "JOIN event_parts ep ON ep.id = rp.part_id " +
            "JOIN registrations r ON r.id = rp.registration_id WHERE r.event_id = ?",
            eventId);

        return jdbcTemplate.query(
            "SELECT id, event_id, persona_id, is_member, fields, amount_owed, amount_paid " +
            "FROM registrations WHERE event_id = ? ORDER BY id",
            (rs, rowNum) -> mapRegistration(rs, parts),
            eventId
        );
    }

    public Optional<RegistrationSnapshot> findRegistration(Long registrationId) {
        Map<Long, Map<String, RegistrationPartStatus>> parts = loadPartStatuses(
            "SELECT rp.registration_id, ep.shortname, rp.status FROM registration_parts rp " +
            "JOIN event_parts ep ON ep.id = rp.part_id WHERE rp.registration_id = ?",
            registrationId);

        return jdbcTemplate.query(
            "SELECT id, event_id, persona_id, is_member, fields, amount_owed, amount_paid " +
            "FROM registrations WHERE id = ?",
            (rs, rowNum) -> mapRegistration(rs, parts),
            registrationId
        ).stream().findFirst();
    }

    public void updateAmountOwed(Long registrationId, BigDecimal amountOwed) {
        jdbcTemplate.update("UPDATE registrations SET amount_owed = ? WHERE id = ?", amountOwed, registrationId);
    }

    /**
     * Adds to the paid amount and returns the new value.
     */
    public BigDecimal addAmountPaid(Long registrationId, BigDecimal amount) {
        return jdbcTemplate.queryForObject(
            "UPDATE registrations SET amount_paid = amount_paid + ? WHERE id = ? RETURNING amount_paid",
            BigDecimal.class,
            amount, registrationId);
    }

    private Map<Long, Map<String, RegistrationPartStatus>> loadPartStatuses(String sql, Long key) {
        Map<Long, Map<String, RegistrationPartStatus>> result = new HashMap<>();
        jdbcTemplate.query(sql, rs -> {
            result.computeIfAbsent(rs.getLong("registration_id"), id -> new HashMap<>())
                .put(rs.getString("shortname"), RegistrationPartStatus.valueOf(rs.getString("status")));
        }, key);
        return result;
    }

    private RegistrationSnapshot mapRegistration(ResultSet rs,
                                                 Map<Long, Map<String, RegistrationPartStatus>> parts)
            throws SQLException {
        long id = rs.getLong("id");
        return new RegistrationSnapshot(
            id,
            rs.getLong("event_id"),
            rs.getLong("persona_id"),
            rs.getBoolean("is_member"),
            Map.copyOf(parts.getOrDefault(id, Map.of())),
            readFields(rs.getString("fields")),
            rs.getBigDecimal("amount_owed"),
            rs.getBigDecimal("amount_paid")
        );
    }

    private Map<String, Object> readFields(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            // keeps null values, unlike Map.copyOf
            return Collections.unmodifiableMap(objectMapper.readValue(json, FIELD_MAP));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable registration fields: " + e.getOriginalMessage(), e);
        }
    }
}
