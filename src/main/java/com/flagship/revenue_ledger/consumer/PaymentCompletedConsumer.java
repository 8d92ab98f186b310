package com.flagship.revenue_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.revenue_ledger.distribution.PaymentStatus;
import com.flagship.revenue_ledger.distribution.PaymentTransaction;
import com.flagship.revenue_ledger.distribution.RevenueDistributor;
import com.flagship.revenue_ledger.exception.LedgerException;
import com.flagship.revenue_ledger.money.Money;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Consumes payment records from the payment subsystem and distributes completed ones.
 *
 * Offsets are acknowledged manually, only after the event has been handled or
 * recorded as skipped or failed. Anything thrown out of the listener leaves the
 * message for redelivery.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PaymentCompletedConsumer {

    static final String CONSUMER_GROUP = "revenue-distribution";
    static final String EVENT_TYPE = "PaymentCompleted";
    static final String AGGREGATE_TYPE = "PaymentTransaction";

    private final IdempotentEventProcessor eventProcessor;
    private final RevenueDistributor revenueDistributor;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.payments-completed:payments.completed}",
        groupId = "${spring.kafka.consumer.group-id:revenue-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        try (CorrelationContext.Scope ignored = CorrelationContext.open(correlationHeader(record))) {
            log.debug("Received payment record: partition={}, offset={}, key={}",
                    record.partition(), record.offset(), record.key());

            PaymentMessage message = parse(record.value());
            if (message == null) {
                log.warn("Could not parse payment record at offset {}, acknowledging to skip", record.offset());
                ack.acknowledge();
                return;
            }

            handle(message);
            ack.acknowledge();
        }
    }

    void handle(PaymentMessage message) {
        PaymentTransaction payment = message.payment();
        if (!payment.isCompleted()) {
            eventProcessor.skipEvent(message.eventId(), EVENT_TYPE, AGGREGATE_TYPE, payment.getId(),
                    CONSUMER_GROUP, "Payment status " + payment.getStatus());
            return;
        }
        boolean processed = eventProcessor.processEvent(message.eventId(), EVENT_TYPE, AGGREGATE_TYPE,
                payment.getId(), CONSUMER_GROUP, () -> revenueDistributor.distribute(payment));
        if (processed) {
            log.info("Distributed payment {} from event {}", payment.getId(), message.eventId());
        }
    }

    /**
     * Reads the fields the ledger needs. The event id defaults to a name-based UUID of the
     * transaction id, so redeliveries of id-less messages still deduplicate.
     */
    PaymentMessage parse(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            String transactionId = text(node, "transactionId");
            if (transactionId == null) {
                log.warn("Payment record without transactionId");
                return null;
            }
            String eventId = text(node, "eventId");
            UUID id = eventId != null
                    ? UUID.fromString(eventId)
                    : UUID.nameUUIDFromBytes(transactionId.getBytes(StandardCharsets.UTF_8));

            PaymentTransaction payment = new PaymentTransaction(
                transactionId,
                Money.parse(text(node, "grossAmount")),
                optionalAmount(node, "serviceCharge"),
                optionalAmount(node, "payeeAmount"),
                text(node, "payeeScopeId"),
                PaymentStatus.fromExternal(text(node, "status"))
            );
            return new PaymentMessage(id, payment);

        } catch (JsonProcessingException | IllegalArgumentException | LedgerException e) {
            log.error("Failed to parse payment record: {}", e.getMessage());
            return null;
        }
    }

    private static Money optionalAmount(JsonNode node, String field) {
        String value = text(node, field);
        return value != null ? Money.parse(value) : null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String correlationHeader(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }

    record PaymentMessage(UUID eventId, PaymentTransaction payment) {}
}
