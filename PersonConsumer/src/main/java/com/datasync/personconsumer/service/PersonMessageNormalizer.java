package com.datasync.personconsumer.service;

import com.datasync.personconsumer.exception.MessageParseException;
import com.datasync.personconsumer.model.PersonRecord;
import com.datasync.personconsumer.util.Timestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;

/**
 * Reads a raw message body into a {@link PersonRecord}.
 *
 * Two payload shapes are accepted:
 * <pre>
 * wrapped: { "eventData": { "id", "name", "email", "createdAt"?, "updatedAt"? }, "createdAt"?, "updatedAt"? }
 * flat:    { "id", "name", "email", "createdAt"?, "updatedAt"? }
 * </pre>
 * The wrapped shape wins whenever "eventData" is an object. Required fields
 * are not checked here; that is left to {@link PersonUpsertWriter}.
 */
@Service
@Slf4j
public class PersonMessageNormalizer {

    static final String EVENT_DATA = "eventData";
    static final String ID = "id";
    static final String NAME = "name";
    static final String EMAIL = "email";
    static final String CREATED_AT = "createdAt";
    static final String UPDATED_AT = "updatedAt";

    private final ObjectMapper objectMapper;

    public PersonMessageNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param body raw message bytes, JSON encoded
     * @return the canonical record; missing fields are null
     * @throws MessageParseException if the body is not a JSON object or holds an unreadable timestamp
     */
    public PersonRecord normalize(byte[] body) {
        if (body == null || body.length == 0) {
            throw new MessageParseException("Empty message body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MessageParseException("Malformed JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MessageParseException("Unreadable message body: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MessageParseException("Expected a JSON object, got "
                    + (root == null || root.isMissingNode() ? "nothing" : root.getNodeType()));
        }

        JsonNode eventData = root.get(EVENT_DATA);
        boolean wrapped = eventData != null && eventData.isObject();
        if (!wrapped) {
            eventData = root;
        }

        PersonRecord record = PersonRecord.builder()
                .id(text(eventData, ID))
                .name(text(eventData, NAME))
                .email(text(eventData, EMAIL))
                .createdAt(timestamp(eventData, root, CREATED_AT))
                .updatedAt(timestamp(eventData, root, UPDATED_AT))
                .build();

        log.trace(" -- Normalized {} payload: id={}", wrapped ? "wrapped" : "flat", record.getId());
        return record;
    }

    // --- helpers ---

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    /**
     * Reads a timestamp from eventData, falling back to the top-level object.
     */
    private static Instant timestamp(JsonNode eventData, JsonNode root, String field) {
        JsonNode value = eventData.get(field);
        if (value == null || value.isNull()) {
            value = root.get(field);
        }
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return Timestamps.fromEpochMillis(value.asLong());
        }
        if (!value.isTextual()) {
            throw new MessageParseException("Field '" + field + "' is not a timestamp: " + value);
        }
        if (StringUtils.isEmpty(value.asText())) {
            return null;
        }
        try {
            return Timestamps.parse(value.asText());
        } catch (IllegalArgumentException e) {
            throw new MessageParseException("Field '" + field + "': " + e.getMessage(), e);
        }
    }
}
