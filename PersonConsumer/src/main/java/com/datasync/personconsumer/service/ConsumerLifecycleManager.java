package com.datasync.personconsumer.service;

import com.datasync.personconsumer.broker.BrokerChannel;
import com.datasync.personconsumer.broker.BrokerConnectionManager;
import com.datasync.personconsumer.broker.QueueInitializer;
import com.datasync.personconsumer.config.ConsumerProperties;
import com.datasync.personconsumer.listener.PersonEventListener;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Starts and stops the person consumer.
 *
 * Startup: connect to the broker (with retries), declare the durable queue,
 * register the listener. Shutdown: close channel then connection; the
 * database pool is drained afterwards by ActiveJDBCConfig.
 */
@Service
@Slf4j
public class ConsumerLifecycleManager {

    private final ConsumerProperties props;
    private final BrokerConnectionManager connectionManager;
    private final QueueInitializer queueInitializer;
    private final PersonEventListener eventListener;
    private final PersonUpsertWriter writer;

    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private volatile boolean running;

    public ConsumerLifecycleManager(ConsumerProperties props,
                                    BrokerConnectionManager connectionManager,
                                    QueueInitializer queueInitializer,
                                    PersonEventListener eventListener,
                                    PersonUpsertWriter writer) {
        this.props = props;
        this.connectionManager = connectionManager;
        this.queueInitializer = queueInitializer;
        this.eventListener = eventListener;
        this.writer = writer;
    }

    @PostConstruct
    public void init() {
        log.info("ConsumerLifecycleManager initialising...");
        start();
    }

    @PreDestroy
    public void destroy() {
        log.info("ConsumerLifecycleManager shutting down...");
        stop();
    }

    /**
     * Connects and starts consuming. A failure after the connection was
     * opened closes it again before the exception propagates.
     */
    public void start() {
        lifecycleLock.lock();
        try {
            if (running) {
                log.warn("Consumer already running - call stop() first.");
                return;
            }

            BrokerChannel channel = connectionManager.connect();
            try {
                String queueName = props.getQueueName();
                queueInitializer.ensureQueue(channel, queueName);
                if (StringUtils.isNotBlank(props.getDeadLetterQueue())) {
                    queueInitializer.ensureQueue(channel, props.getDeadLetterQueue().trim());
                }
                channel.consume(queueName, delivery -> eventListener.onDelivery(channel, delivery));
                running = true;
                log.info("Consuming queue '{}' and writing to table '{}'.", queueName, writer.getTableName());
            } catch (RuntimeException e) {
                connectionManager.close();
                throw e;
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Closes channel then connection. Never throws.
     */
    public void stop() {
        lifecycleLock.lock();
        try {
            connectionManager.close();
            running = false;
            log.info("Consumer stopped.");
        } finally {
            lifecycleLock.unlock();
        }
    }

    public boolean isRunning() {
        return running && connectionManager.isConnected();
    }
}
