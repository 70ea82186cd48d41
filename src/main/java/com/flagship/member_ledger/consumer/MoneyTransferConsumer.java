package com.flagship.member_ledger.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.member_ledger.ledger.FinanceActor;
import com.flagship.member_ledger.ledger.Persona;
import com.flagship.member_ledger.membership.MembershipService;
import com.flagship.member_ledger.membership.MoneyTransfer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Books bank statement lines published by the banking import to the money-transfers
 * topic.
 *
 * Each line carries a transferId; the processed_events table makes redelivered lines
 * harmless. Lines the ledger rejects (unknown persona, archived persona, negative
 * result) are recorded as skipped and acknowledged, so they do not block the
 * partition. Anything else is not acknowledged and will be redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MoneyTransferConsumer {

    public static final String CONSUMER_GROUP = "money-transfer-consumer";
    static final String EVENT_TYPE = "MoneyTransferReceived";

    private final IdempotentEventProcessor eventProcessor;
    private final MembershipService membershipService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.money-transfers:money-transfers}",
        groupId = "${spring.kafka.consumer.group-id:member-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received money transfer: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());

        TransferMessage message = parse(record.value());
        if (message == null) {
            log.warn("Could not parse money transfer at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        handle(message);
        ack.acknowledge();
    }

    /**
     * @return true if the transfer was booked by this call
     */
    boolean handle(TransferMessage message) {
        String aggregateId = message.transfer().getPersonaId().toString();
        try {
            boolean booked = eventProcessor.processEvent(
                message.transferId(), EVENT_TYPE,
                Persona.AGGREGATE_TYPE, aggregateId,
                CONSUMER_GROUP,
                () -> membershipService.receiveMoneyTransfer(message.transfer(), FinanceActor.system())
            );
            if (booked) {
                log.info("Money transfer booked: transferId={}, personaId={}, amount={}",
                        message.transferId(), aggregateId, message.transfer().getAmount());
            }
            return booked;
        } catch (IllegalArgumentException | IllegalStateException e) {
            eventProcessor.skipEvent(message.transferId(), EVENT_TYPE, Persona.AGGREGATE_TYPE, aggregateId,
                CONSUMER_GROUP, e.getMessage());
            return false;
        }
    }

    TransferMessage parse(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            UUID transferId = UUID.fromString(node.get("transferId").asText());
            Long personaId = node.get("personaId").asLong();
            BigDecimal amount = new BigDecimal(node.get("amount").asText());
            LocalDate transactionDate = node.hasNonNull("transactionDate")
                ? LocalDate.parse(node.get("transactionDate").asText())
                : null;
            String note = node.hasNonNull("note") ? node.get("note").asText() : null;
            return new TransferMessage(transferId, new MoneyTransfer(personaId, amount, transactionDate, note));
        } catch (Exception e) {
            log.error("Failed to parse money transfer: {}", e.getMessage());
            return null;
        }
    }

    record TransferMessage(UUID transferId, MoneyTransfer transfer) {}
}
