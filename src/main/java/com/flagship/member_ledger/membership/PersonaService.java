package com.flagship.member_ledger.membership;

import com.flagship.member_ledger.ledger.FinanceActor;
import com.flagship.member_ledger.ledger.FinanceLogCode;
import com.flagship.member_ledger.ledger.LedgerService;
import com.flagship.member_ledger.ledger.Persona;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the finance record of a persona. New personas start with a zero balance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PersonaService {

    private final JdbcTemplate jdbcTemplate;
    private final LedgerService ledgerService;

    /**
     * @param member      whether the persona joins as a member
     * @param trialMember whether the membership is a trial membership (implies member)
     */
    @Transactional
    public Persona createPersona(String givenNames, String familyName, boolean member, boolean trialMember,
                                 FinanceActor actor) {
        if (givenNames == null || givenNames.isBlank() || familyName == null || familyName.isBlank()) {
            throw new IllegalArgumentException("Given names and family name are required");
        }
        boolean isMember = member || trialMember;
        Long personaId = jdbcTemplate.queryForObject(
            "INSERT INTO personas (given_names, family_name, balance, is_member, trial_member) " +
            "VALUES (?, ?, 0, ?, ?) RETURNING id",
            Long.class, givenNames.trim(), familyName.trim(), isMember, trialMember);

        if (trialMember) {
            ledgerService.appendLog(FinanceLogCode.START_TRIAL_MEMBERSHIP, actor, personaId, null, null, null, null);
        } else if (isMember) {
            ledgerService.appendLog(FinanceLogCode.NEW_MEMBER, actor, personaId, null, null, null, null);
        }

        log.info("Persona created: personaId={}, member={}, trialMember={}", personaId, isMember, trialMember);
        return ledgerService.findPersona(personaId)
            .orElseThrow(() -> new IllegalStateException("Persona vanished after insert: " + personaId));
    }
}
