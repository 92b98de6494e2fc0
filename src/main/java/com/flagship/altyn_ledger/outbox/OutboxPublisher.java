package com.flagship.altyn_ledger.outbox;

import com.flagship.altyn_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ships committed ledger events from the outbox to Kafka.
 *
 * Events are sent one at a time in sequence order, keyed by aggregate id so
 * all events of one transaction or payout land on the same partition.
 * A send is acknowledged before the event is marked published; on failure
 * the retry count grows until the event is left for manual replay.
 * Delivery is at-least-once: a crash between the send and the mark, or a
 * second publisher claiming the same pending row, ships it again, so
 * consumers deduplicate by event id.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.claimBatch(batchSize, maxRetries);
        } catch (Exception e) {
            log.error("Could not read outbox batch", e);
            return;
        }

        for (OutboxEvent event : batch) {
            publish(event);
        }
    }

    private void publish(OutboxEvent event) {
        String key = event.getAggregateId().toString();
        try {
            SendResult<String, String> result =
                    kafkaTemplate.send(ledgerEventsTopic, key, event.getPayload()).get();

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

            log.debug("Published ledger event: eventId={}, eventType={}, partition={}, offset={}",
                    event.getId(), event.getEventType(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
        } catch (Exception e) {
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.error("Ledger event exhausted retries: eventId={}, eventType={}, aggregateId={}",
                        event.getId(), event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }
}
