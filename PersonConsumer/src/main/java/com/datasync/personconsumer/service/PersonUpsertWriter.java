package com.datasync.personconsumer.service;

import com.datasync.personconsumer.config.ActiveJDBCConfig;
import com.datasync.personconsumer.config.ConsumerProperties;
import com.datasync.personconsumer.exception.PersonValidationException;
import com.datasync.personconsumer.exception.StorageException;
import com.datasync.personconsumer.model.PersonRecord;
import com.datasync.personconsumer.util.SqlIdentifiers;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.javalite.activejdbc.Base;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;

/**
 * Person Upsert Writer
 *
 * Applies a {@link PersonRecord} to the destination table with a single
 * insert-or-update statement keyed on id, so redelivered or duplicated
 * messages converge to the same row. Concurrent writes for one id resolve
 * as last-writer-wins on name, email and updatedAt.
 */
@Service
@Slf4j
public class PersonUpsertWriter {

    private final ActiveJDBCConfig activeJDBCConfig;
    private final String tableName;
    private final String upsertSql;
    private final Clock clock;

    @Autowired
    public PersonUpsertWriter(ActiveJDBCConfig activeJDBCConfig,
                              ConsumerProperties props,
                              @Value("${spring.datasource.url:}") String jdbcUrl,
                              Clock clock) {
        this(activeJDBCConfig, SqlDialect.resolve(props.getSqlDialect(), jdbcUrl), props.getTableName(), clock);
    }

    public PersonUpsertWriter(ActiveJDBCConfig activeJDBCConfig, SqlDialect dialect, String tableName, Clock clock) {
        this.activeJDBCConfig = activeJDBCConfig;
        this.tableName = SqlIdentifiers.validate(tableName, "table");
        this.upsertSql = dialect.upsertSql(this.tableName);
        this.clock = clock;
        log.info("Person upsert writer ready: table={}, dialect={}", this.tableName, dialect);
    }

    /**
     * Inserts the person, or overwrites name, email and updatedAt of the existing row.
     *
     * @throws PersonValidationException if id, name or email is missing; nothing is sent to the database
     * @throws StorageException if the statement fails
     */
    public void upsert(PersonRecord record) {
        validate(record);

        Instant now = clock.instant();
        Timestamp createdAt = Timestamp.from(record.getCreatedAt() != null ? record.getCreatedAt() : now);
        Timestamp updatedAt = Timestamp.from(record.getUpdatedAt() != null ? record.getUpdatedAt() : now);

        try {
            activeJDBCConfig.openConnection();
            int rows = Base.exec(upsertSql,
                    record.getId(),
                    record.getName(),
                    record.getEmail(),
                    createdAt,
                    updatedAt);
            log.trace(" -- Upserted person: id={}, rows={}", record.getId(), rows);
        } catch (RuntimeException e) {
            throw new StorageException("Failed to upsert person " + record.getId() + " into " + tableName
                    + ": " + e.getMessage(), e);
        } finally {
            activeJDBCConfig.closeConnection();
        }
    }

    public String getTableName() {
        return tableName;
    }

    private static void validate(PersonRecord record) {
        if (record == null) {
            throw new PersonValidationException("Missing person record");
        }
        if (StringUtils.isAnyEmpty(record.getId(), record.getName(), record.getEmail())) {
            throw new PersonValidationException(String.format(
                    "Missing required person fields (id, name, email): id=%s, name=%s, email=%s",
                    present(record.getId()), present(record.getName()), present(record.getEmail())));
        }
    }

    private static String present(String value) {
        return StringUtils.isEmpty(value) ? "<missing>" : "ok";
    }
}
