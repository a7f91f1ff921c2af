package com.datasync.personconsumer.service;

import com.datasync.personconsumer.config.JacksonConfig;
import com.datasync.personconsumer.exception.MessageParseException;
import com.datasync.personconsumer.model.PersonRecord;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PersonMessageNormalizerTest {

    private final PersonMessageNormalizer normalizer =
            new PersonMessageNormalizer(JacksonConfig.createObjectMapper());

    @Test
    void wrappedAndFlatPayloadsNormalizeToTheSameRecord() {
        PersonRecord wrapped = normalize("{\"eventData\":{\"id\":\"1\",\"name\":\"A\",\"email\":\"a@x.com\"}}");
        PersonRecord flat = normalize("{\"id\":\"1\",\"name\":\"A\",\"email\":\"a@x.com\"}");

        assertThat(wrapped).isEqualTo(flat);
        assertThat(flat).isEqualTo(new PersonRecord("1", "A", "a@x.com", null, null));
    }

    @Test
    void timestampsPreferEventDataOverTopLevel() {
        PersonRecord record = normalize("{"
                + "\"eventData\":{\"id\":\"7\",\"name\":\"B\",\"email\":\"b@x.com\",\"updatedAt\":\"2024-03-02T10:00:00Z\"},"
                + "\"createdAt\":\"2024-01-01T00:00:00Z\","
                + "\"updatedAt\":\"2020-01-01T00:00:00Z\"}");

        assertThat(record.getCreatedAt()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(record.getUpdatedAt()).isEqualTo(Instant.parse("2024-03-02T10:00:00Z"));
    }

    @Test
    void topLevelFieldsAreIgnoredWhenWrapped() {
        PersonRecord record = normalize("{\"eventData\":{\"id\":\"1\"},\"name\":\"outer\",\"email\":\"outer@x.com\"}");

        assertThat(record.getId()).isEqualTo("1");
        assertThat(record.getName()).isNull();
        assertThat(record.getEmail()).isNull();
    }

    @Test
    void nonObjectEventDataFallsBackToFlatShape() {
        PersonRecord record = normalize("{\"eventData\":\"person.updated\",\"id\":\"2\",\"name\":\"C\",\"email\":\"c@x.com\"}");

        assertThat(record.getId()).isEqualTo("2");
        assertThat(record.getName()).isEqualTo("C");
    }

    @Test
    void missingFieldsAreLeftForTheWriterToReject() {
        PersonRecord record = normalize("{\"id\":\"3\",\"name\":\"D\"}");

        assertThat(record.getId()).isEqualTo("3");
        assertThat(record.getEmail()).isNull();
    }

    @Test
    void scalarValuesAreReadAsText() {
        PersonRecord record = normalize("{\"id\":42,\"name\":\"E\",\"email\":\"e@x.com\",\"createdAt\":1700000000000}");

        assertThat(record.getId()).isEqualTo("42");
        assertThat(record.getCreatedAt()).isEqualTo(Instant.ofEpochMilli(1700000000000L));
    }

    @Test
    void structuredValuesAreNotTakenAsFields() {
        PersonRecord record = normalize("{\"id\":{\"value\":\"1\"},\"name\":[\"F\"],\"email\":null}");

        assertThat(record.getId()).isNull();
        assertThat(record.getName()).isNull();
        assertThat(record.getEmail()).isNull();
    }

    @Test
    void localDateTimesAreReadAsUtc() {
        PersonRecord record = normalize("{\"id\":\"1\",\"createdAt\":\"2024-05-01 12:30:00\",\"updatedAt\":\"2024-05-01\"}");

        assertThat(record.getCreatedAt()).isEqualTo(Instant.parse("2024-05-01T12:30:00Z"));
        assertThat(record.getUpdatedAt()).isEqualTo(Instant.parse("2024-05-01T00:00:00Z"));
    }

    @Test
    void emptyTimestampsAreTreatedAsAbsent() {
        PersonRecord record = normalize("{\"id\":\"1\",\"name\":\"A\",\"email\":\"a@x.com\",\"createdAt\":\"\",\"updatedAt\":\"\"}");

        assertThat(record).isEqualTo(new PersonRecord("1", "A", "a@x.com", null, null));
    }

    @Test
    void emptyWrappedTimestampDoesNotFallBackToTopLevel() {
        PersonRecord record = normalize("{\"eventData\":{\"id\":\"1\",\"createdAt\":\"\"},"
                + "\"createdAt\":\"2024-01-01T00:00:00Z\"}");

        assertThat(record.getCreatedAt()).isNull();
    }

    @Test
    void fractionalAndExponentNumbersAreEpochMillis() {
        PersonRecord record = normalize("{\"id\":\"1\",\"createdAt\":1.7E12,\"updatedAt\":1700000000000.9}");

        assertThat(record.getCreatedAt()).isEqualTo(Instant.ofEpochMilli(1700000000000L));
        assertThat(record.getUpdatedAt()).isEqualTo(Instant.ofEpochMilli(1700000000000L));
    }

    @ParameterizedTest
    @ValueSource(strings = {"not json", "{\"id\":", "[1,2,3]", "\"text\"", "42", "{\"id\":\"1\"} trailing", "   "})
    void nonObjectBodiesAreParseErrors(String body) {
        assertThatThrownBy(() -> normalize(body))
                .isInstanceOf(MessageParseException.class);
    }

    @Test
    void emptyAndMissingBodiesAreParseErrors() {
        assertThatThrownBy(() -> normalizer.normalize(new byte[0]))
                .isInstanceOf(MessageParseException.class);
        assertThatThrownBy(() -> normalizer.normalize(null))
                .isInstanceOf(MessageParseException.class);
    }

    @Test
    void unreadableTimestampIsParseError() {
        assertThatThrownBy(() -> normalize("{\"id\":\"1\",\"name\":\"A\",\"email\":\"a@x.com\",\"createdAt\":\"yesterday\"}"))
                .isInstanceOf(MessageParseException.class)
                .hasMessageContaining("createdAt");
        assertThatThrownBy(() -> normalize("{\"id\":\"1\",\"updatedAt\":true}"))
                .isInstanceOf(MessageParseException.class)
                .hasMessageContaining("updatedAt");
    }

    private PersonRecord normalize(String json) {
        return normalizer.normalize(json.getBytes(StandardCharsets.UTF_8));
    }
}
