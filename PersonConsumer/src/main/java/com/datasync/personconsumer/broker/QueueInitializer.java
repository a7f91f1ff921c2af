package com.datasync.personconsumer.broker;

import com.datasync.personconsumer.exception.BrokerChannelException;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Declares the work queue as durable. Safe to run on every startup.
 */
@Component
@Slf4j
public class QueueInitializer {

    public void ensureQueue(BrokerChannel channel, String queueName) {
        if (channel == null || !channel.isOpen()) {
            throw new BrokerChannelException("Channel not initialized, cannot declare queue '" + queueName + "'");
        }
        boolean created = channel.declareDurableQueue(queueName);
        log.info("Queue '{}' ready (durable, {})", queueName, created ? "created" : "already present");
    }
}
