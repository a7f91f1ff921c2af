package com.datasync.personconsumer.broker;

import com.datasync.personconsumer.exception.BrokerChannelException;

import jakarta.jms.BytesMessage;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import jakarta.jms.MessageConsumer;
import jakarta.jms.MessageProducer;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import lombok.extern.slf4j.Slf4j;
import org.apache.activemq.artemis.api.core.ActiveMQException;
import org.apache.activemq.artemis.api.core.ActiveMQQueueExistsException;
import org.apache.activemq.artemis.api.core.QueueConfiguration;
import org.apache.activemq.artemis.api.core.RoutingType;
import org.apache.activemq.artemis.api.core.SimpleString;
import org.apache.activemq.artemis.api.core.client.ClientSession;
import org.apache.activemq.artemis.jms.client.ActiveMQSession;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Broker channel backed by an Artemis JMS session in INDIVIDUAL_ACKNOWLEDGE mode.
 *
 * JMS has no negative acknowledgement: a rejected delivery is acknowledged
 * without having been written, which removes it from the queue for good.
 * When a dead-letter queue is configured, a copy of the body is sent there first.
 */
@Slf4j
public class ArtemisBrokerChannel implements BrokerChannel {

    static final String PROP_REJECT_REASON = "rejectReason";
    static final String PROP_ORIGINAL_QUEUE = "originalQueue";
    static final String PROP_ORIGINAL_MESSAGE_ID = "originalMessageId";

    private final Session session;
    private final String deadLetterQueue;

    private volatile boolean open = true;
    private MessageConsumer consumer;
    private MessageProducer deadLetterProducer;
    private String consumedQueue;

    public ArtemisBrokerChannel(Session session, String deadLetterQueue) {
        this.session = session;
        this.deadLetterQueue = StringUtils.trimToNull(deadLetterQueue);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public boolean declareDurableQueue(String queueName) {
        requireOpen("declare queue " + queueName);
        ClientSession core = coreSession();
        try {
            ClientSession.QueueQuery query = core.queueQuery(SimpleString.toSimpleString(queueName));
            if (query.isExists()) {
                if (!query.isDurable()) {
                    throw new BrokerChannelException(
                            "Queue '" + queueName + "' already exists and is not durable");
                }
                log.debug("Durable queue already present: {}", queueName);
                return false;
            }
            core.createQueue(new QueueConfiguration(queueName)
                    .setAddress(queueName)
                    .setRoutingType(RoutingType.ANYCAST)
                    .setDurable(true)
                    .setAutoCreateAddress(true));
            log.info("Created durable queue: {}", queueName);
            return true;
        } catch (ActiveMQQueueExistsException e) {
            // created concurrently by another consumer between query and create
            log.debug("Queue {} created concurrently, keeping it", queueName);
            return false;
        } catch (ActiveMQException e) {
            throw new BrokerChannelException("Failed to declare queue '" + queueName + "'", e);
        }
    }

    @Override
    public void consume(String queueName, Consumer<Delivery> handler) {
        requireOpen("consume from " + queueName);
        if (consumer != null) {
            throw new BrokerChannelException("Channel already consumes from '" + consumedQueue + "'");
        }
        try {
            consumer = session.createConsumer(session.createQueue(queueName));
            consumedQueue = queueName;
            consumer.setMessageListener(message -> handler.accept(toDelivery(message)));
            log.info("Registered consumer on queue: {}", queueName);
        } catch (JMSException e) {
            throw new BrokerChannelException("Failed to register consumer on '" + queueName + "'", e);
        }
    }

    @Override
    public void ack(Delivery delivery) {
        requireOpen("ack " + delivery.getMessageId());
        acknowledge(delivery);
    }

    @Override
    public void reject(Delivery delivery, String reason) {
        requireOpen("reject " + delivery.getMessageId());
        if (deadLetterQueue != null) {
            forwardToDeadLetter(delivery, reason);
        }
        acknowledge(delivery);
        log.debug("Rejected message {} without requeue", delivery.getMessageId());
    }

    /**
     * Closes the session. Errors are logged, never thrown.
     */
    @Override
    public void close() {
        if (!open) {
            return;
        }
        open = false;
        if (consumer != null) {
            try {
                consumer.close();
            } catch (Exception e) {
                log.warn("Error closing consumer on {}: {}", consumedQueue, e.getMessage());
            }
        }
        try {
            session.close();
            log.info("Broker channel closed");
        } catch (Exception e) {
            log.warn("Error closing broker channel: {}", e.getMessage());
        }
    }

    // --- internal helpers ---

    private void acknowledge(Delivery delivery) {
        try {
            delivery.getMessage().acknowledge();
        } catch (JMSException e) {
            throw new BrokerChannelException("Failed to acknowledge message " + delivery.getMessageId(), e);
        }
    }

    private void forwardToDeadLetter(Delivery delivery, String reason) {
        try {
            if (deadLetterProducer == null) {
                deadLetterProducer = session.createProducer(session.createQueue(deadLetterQueue));
            }
            BytesMessage copy = session.createBytesMessage();
            if (delivery.getBody() != null) {
                copy.writeBytes(delivery.getBody());
            }
            copy.setStringProperty(PROP_REJECT_REASON, reason);
            copy.setStringProperty(PROP_ORIGINAL_QUEUE, consumedQueue);
            copy.setStringProperty(PROP_ORIGINAL_MESSAGE_ID, delivery.getMessageId());
            deadLetterProducer.send(copy);
            log.debug("Forwarded rejected message {} to {}", delivery.getMessageId(), deadLetterQueue);
        } catch (JMSException e) {
            throw new BrokerChannelException(
                    "Failed to forward message " + delivery.getMessageId() + " to " + deadLetterQueue, e);
        }
    }

    private Delivery toDelivery(Message message) {
        String messageId = null;
        boolean redelivered = false;
        byte[] body = null;
        try {
            messageId = message.getJMSMessageID();
            redelivered = message.getJMSRedelivered();
            body = readBody(message);
        } catch (JMSException e) {
            log.warn("Could not read message {}: {}", messageId, e.getMessage());
        }
        return Delivery.builder()
                .messageId(messageId)
                .body(body)
                .redelivered(redelivered)
                .message(message)
                .build();
    }

    private byte[] readBody(Message message) throws JMSException {
        if (message instanceof TextMessage) {
            String text = ((TextMessage) message).getText();
            return text != null ? text.getBytes(StandardCharsets.UTF_8) : null;
        }
        if (message instanceof BytesMessage) {
            BytesMessage bytesMessage = (BytesMessage) message;
            byte[] bytes = new byte[(int) bytesMessage.getBodyLength()];
            bytesMessage.readBytes(bytes);
            return bytes;
        }
        log.debug("Unsupported message type {}", message.getClass().getSimpleName());
        return null;
    }

    private ClientSession coreSession() {
        if (!(session instanceof ActiveMQSession)) {
            throw new BrokerChannelException(
                    "Queue declaration needs an Artemis session, got " + session.getClass().getName());
        }
        return ((ActiveMQSession) session).getCoreSession();
    }

    private void requireOpen(String operation) {
        if (!open) {
            throw new BrokerChannelException("Channel not open, cannot " + operation);
        }
    }
}
