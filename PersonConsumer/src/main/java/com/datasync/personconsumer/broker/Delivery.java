package com.datasync.personconsumer.broker;

import jakarta.jms.Message;
import lombok.Builder;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * A message handed over by the broker, not yet acknowledged.
 *
 * The body is the raw payload; the JMS message is kept only so the channel
 * can acknowledge it once processing has finished.
 */
@Getter
@Builder
public class Delivery {

    private static final int PREVIEW_LENGTH = 200;

    /** Broker message id (may be null when the producer disabled ids). */
    private final String messageId;

    /** Raw payload bytes, null when the message carried no readable body. */
    private final byte[] body;

    /** True when the broker delivers this message again after a consumer failure. */
    private final boolean redelivered;

    /** Underlying JMS message, used for acknowledgement. */
    private final Message message;

    /**
     * Payload as text, truncated for log lines.
     */
    public String preview() {
        if (body == null) {
            return "<no body>";
        }
        String text = new String(body, StandardCharsets.UTF_8);
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }
}
