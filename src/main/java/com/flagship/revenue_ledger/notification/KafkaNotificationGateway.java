package com.flagship.revenue_ledger.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Publishes notifications and alerts to Kafka for the notification subsystem.
 *
 * Sends are asynchronous. Failures, whether immediate (serialization, producer
 * buffer full) or reported later by the broker, are logged and counted but never
 * propagated to the ledger operation that triggered them.
 */
@Component
@Slf4j
public class KafkaNotificationGateway implements NotificationGateway {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics metrics;
    private final String alertsTopic;
    private final String payeeNotificationsTopic;

    public KafkaNotificationGateway(KafkaTemplate<String, String> kafkaTemplate,
                                    ObjectMapper objectMapper,
                                    LedgerMetrics metrics,
                                    @Value("${kafka.topic.alerts:ledger.alerts}") String alertsTopic,
                                    @Value("${kafka.topic.payee-notifications:payee.notifications}")
                                    String payeeNotificationsTopic) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.alertsTopic = alertsTopic;
        this.payeeNotificationsTopic = payeeNotificationsTopic;
    }

    @Override
    public void notifyPayee(PayeeRevenueNotification notification) {
        send(payeeNotificationsTopic, notification.getPayeeOwnerId(), notification, "payee");
    }

    @Override
    public void raiseAlert(LedgerAlert alert) {
        log.warn("Ledger alert raised: type={}, level={}, message={}",
                alert.getAlertType(), alert.getLevel(), alert.getMessage());
        send(alertsTopic, alert.getAlertType(), alert, "alert");
    }

    private void send(String topic, String key, Object payload, String kind) {
        try {
            ProducerRecord<String, String> record =
                    new ProducerRecord<>(topic, key, objectMapper.writeValueAsString(payload));
            record.headers().add(CorrelationContext.CORRELATION_ID_HEADER,
                    CorrelationContext.getCorrelationId().getBytes(StandardCharsets.UTF_8));

            kafkaTemplate.send(record).whenComplete((result, ex) -> {
                if (ex != null) {
                    metrics.recordNotificationFailure(kind);
                    log.warn("Failed to deliver {} notification to {}: {}", kind, topic, ex.getMessage());
                }
            });
        } catch (Exception e) {
            metrics.recordNotificationFailure(kind);
            log.warn("Could not hand off {} notification to {}: {}", kind, topic, e.getMessage());
        }
    }
}
