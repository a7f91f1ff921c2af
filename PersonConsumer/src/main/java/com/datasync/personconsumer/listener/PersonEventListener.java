package com.datasync.personconsumer.listener;

import com.datasync.personconsumer.broker.BrokerChannel;
import com.datasync.personconsumer.broker.Delivery;
import com.datasync.personconsumer.exception.BrokerChannelException;
import com.datasync.personconsumer.exception.PersonProcessingException;
import com.datasync.personconsumer.model.PersonRecord;
import com.datasync.personconsumer.service.PersonMessageNormalizer;
import com.datasync.personconsumer.service.PersonUpsertWriter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Person Event Listener
 *
 * Handles each delivery from the person queue: normalize, upsert, then
 * acknowledge. A message that cannot be parsed, validated or stored is
 * logged and rejected without requeue, so a poison message never blocks the
 * queue. Rejected messages are not retried; a message lost this way has to
 * be republished by the producer.
 *
 * The disposition is issued only after the write attempt has finished, and
 * exactly once per delivery.
 */
@Component
@Slf4j
public class PersonEventListener {

    private final PersonMessageNormalizer normalizer;
    private final PersonUpsertWriter writer;

    public PersonEventListener(PersonMessageNormalizer normalizer, PersonUpsertWriter writer) {
        this.normalizer = normalizer;
        this.writer = writer;
    }

    /**
     * Processes one delivery and resolves it on the given channel.
     *
     * @param channel  channel the delivery came from
     * @param delivery the unacknowledged message
     * @return the disposition that was issued
     */
    public DeliveryOutcome onDelivery(BrokerChannel channel, Delivery delivery) {
        log.debug("Received message: messageId={}, redelivered={}", delivery.getMessageId(), delivery.isRedelivered());

        PersonRecord record;
        try {
            record = normalizer.normalize(delivery.getBody());
            writer.upsert(record);
        } catch (PersonProcessingException e) {
            log.error("Failed to process message {} ({}): {} - payload={}",
                    delivery.getMessageId(), e.getClass().getSimpleName(), e.getMessage(), delivery.preview());
            return reject(channel, delivery, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error processing message {}: {} - payload={}",
                    delivery.getMessageId(), e.getMessage(), delivery.preview(), e);
            return reject(channel, delivery, e);
        }

        try {
            channel.ack(delivery);
        } catch (BrokerChannelException e) {
            // unacknowledged: the broker redelivers it, the upsert makes the replay harmless
            log.error("Failed to acknowledge message {} for person {}: {}",
                    delivery.getMessageId(), record.getId(), e.getMessage(), e);
            return DeliveryOutcome.ACKED;
        }
        log.info("Upserted person {}", record.getId());
        return DeliveryOutcome.ACKED;
    }

    private DeliveryOutcome reject(BrokerChannel channel, Delivery delivery, Exception cause) {
        try {
            channel.reject(delivery, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (BrokerChannelException e) {
            log.error("Failed to reject message {}: {}", delivery.getMessageId(), e.getMessage(), e);
        }
        return DeliveryOutcome.REJECTED;
    }
}
