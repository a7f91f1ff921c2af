package com.datasync.personconsumer.broker;

import java.util.function.Consumer;

/**
 * A single session opened on the broker connection.
 *
 * Deliveries registered through {@link #consume} are handed to the handler
 * one at a time; each must be resolved with exactly one call to
 * {@link #ack} or {@link #reject}.
 */
public interface BrokerChannel extends AutoCloseable {

    boolean isOpen();

    /**
     * Declares a durable queue. Returns true if the queue was created,
     * false if it already existed.
     */
    boolean declareDurableQueue(String queueName);

    void consume(String queueName, Consumer<Delivery> handler);

    void ack(Delivery delivery);

    /**
     * Negative acknowledgement without requeue: the delivery is removed from
     * the queue and never redelivered.
     */
    void reject(Delivery delivery, String reason);

    @Override
    void close();
}
