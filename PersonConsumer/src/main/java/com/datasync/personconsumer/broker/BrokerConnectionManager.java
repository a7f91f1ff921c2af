package com.datasync.personconsumer.broker;

import com.datasync.personconsumer.exception.BrokerConnectionException;

import jakarta.jms.Connection;
import jakarta.jms.ConnectionFactory;
import jakarta.jms.JMSException;
import jakarta.jms.Session;
import lombok.extern.slf4j.Slf4j;
import org.apache.activemq.artemis.api.jms.ActiveMQJMSConstants;

/**
 * Owns the broker connection and the single channel opened on it.
 *
 * {@link #connect()} retries with exponential backoff until the retry budget
 * is spent; {@link #close()} tears down channel then connection and never throws.
 */
@Slf4j
public class BrokerConnectionManager {

    private final ConnectionFactory connectionFactory;
    private final BrokerUrl brokerUrl;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final String deadLetterQueue;

    private Connection connection;
    private BrokerChannel channel;

    public BrokerConnectionManager(ConnectionFactory connectionFactory,
                                   BrokerUrl brokerUrl,
                                   BackoffPolicy backoffPolicy,
                                   Sleeper sleeper,
                                   String deadLetterQueue) {
        this.connectionFactory = connectionFactory;
        this.brokerUrl = brokerUrl;
        this.backoffPolicy = backoffPolicy;
        this.sleeper = sleeper;
        this.deadLetterQueue = deadLetterQueue;
    }

    /**
     * Opens a connection and a channel on it.
     *
     * @return the open channel
     * @throws BrokerConnectionException when every attempt failed; the cause is the last error
     */
    public synchronized BrokerChannel connect() {
        if (channel != null && channel.isOpen()) {
            return channel;
        }

        int maxAttempts = backoffPolicy.getMaxAttempts();
        Exception lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                channel = openChannel();
                log.info("Connected to broker ({})", brokerUrl.redacted());
                return channel;
            } catch (JMSException | RuntimeException e) {
                lastError = e;
                closeConnectionQuietly();

                long delayMs = backoffPolicy.delayForAttempt(attempt);
                if (attempt == maxAttempts) {
                    // no wait after the last attempt, the delay is reported for the schedule only
                    log.warn("Broker connection failed (attempt {}/{}). Giving up instead of retrying in {}ms: {}",
                            attempt, maxAttempts, delayMs, e.getMessage());
                    break;
                }

                log.warn("Broker connection failed (attempt {}/{}). Retrying in {}ms...: {}",
                        attempt, maxAttempts, delayMs, e.getMessage());
                try {
                    sleeper.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new BrokerConnectionException("Interrupted while waiting to reconnect to broker", e);
                }
            }
        }

        throw new BrokerConnectionException(
                "Failed to connect to broker after " + maxAttempts + " attempts: "
                        + (lastError != null ? lastError.getMessage() : "unknown error"),
                lastError);
    }

    public synchronized boolean isConnected() {
        return channel != null && channel.isOpen();
    }

    /**
     * Closes the channel, then the connection. Failures are logged and each
     * step runs regardless of the previous one.
     */
    public synchronized void close() {
        if (channel != null) {
            try {
                channel.close();
            } catch (Exception e) {
                log.warn("Error closing broker channel: {}", e.getMessage());
            }
            channel = null;
        }
        if (connection != null) {
            try {
                connection.close();
                log.info("Broker connection closed");
            } catch (Exception e) {
                log.warn("Error closing broker connection: {}", e.getMessage());
            }
            connection = null;
        }
    }

    // --- internal helpers ---

    private BrokerChannel openChannel() throws JMSException {
        connection = connectionFactory.createConnection();
        connection.setExceptionListener(ex ->
                log.warn("Broker connection exception: {} - client will attempt reconnect", ex.getMessage()));
        Session session = connection.createSession(false, ActiveMQJMSConstants.INDIVIDUAL_ACKNOWLEDGE);
        connection.start();
        return new ArtemisBrokerChannel(session, deadLetterQueue);
    }

    private void closeConnectionQuietly() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (Exception e) {
            log.debug("Ignoring close failure of half-open connection: {}", e.getMessage());
        }
        connection = null;
    }
}
