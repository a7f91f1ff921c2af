package com.datasync.personconsumer.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Canonical person, independent of the payload shape it was read from.
 *
 * Fields are not validated here; timestamps stay null until the writer
 * resolves them to the processing time.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PersonRecord {

    /** Primary key of the destination row */
    private String id;

    private String name;

    private String email;

    private Instant createdAt;

    private Instant updatedAt;
}
