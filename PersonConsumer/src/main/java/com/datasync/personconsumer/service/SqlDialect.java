package com.datasync.personconsumer.service;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * Insert-or-update statement per database. Only name, email and updatedAt
 * are overwritten on conflict; createdAt keeps its first value.
 */
public enum SqlDialect {

    POSTGRESQL {
        @Override
        public String upsertSql(String table) {
            return "INSERT INTO " + table + " (id, name, email, createdAt, updatedAt) " +
                   "VALUES (?, ?, ?, ?, ?) " +
                   "ON CONFLICT (id) DO UPDATE SET " +
                   "  name      = EXCLUDED.name, " +
                   "  email     = EXCLUDED.email, " +
                   "  updatedAt = EXCLUDED.updatedAt";
        }
    },

    MYSQL {
        @Override
        public String upsertSql(String table) {
            return "INSERT INTO " + table + " (id, name, email, createdAt, updatedAt) " +
                   "VALUES (?, ?, ?, ?, ?) " +
                   "ON DUPLICATE KEY UPDATE " +
                   "  name      = VALUES(name), " +
                   "  email     = VALUES(email), " +
                   "  updatedAt = VALUES(updatedAt)";
        }
    };

    /**
     * @param table a validated table identifier
     */
    public abstract String upsertSql(String table);

    /**
     * Resolves the configured dialect name, or infers it from the JDBC URL when none is configured.
     */
    public static SqlDialect resolve(String configured, String jdbcUrl) {
        if (StringUtils.isNotBlank(configured)) {
            try {
                return valueOf(configured.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unsupported SQL dialect: " + configured, e);
            }
        }
        return fromJdbcUrl(jdbcUrl);
    }

    public static SqlDialect fromJdbcUrl(String jdbcUrl) {
        String url = jdbcUrl == null ? "" : jdbcUrl.toLowerCase(Locale.ROOT);
        if (url.startsWith("jdbc:postgresql:")) {
            return POSTGRESQL;
        }
        if (url.startsWith("jdbc:mysql:") || url.startsWith("jdbc:mariadb:")) {
            return MYSQL;
        }
        if (url.startsWith("jdbc:h2:") && url.contains("mode=mysql")) {
            return MYSQL;
        }
        throw new IllegalArgumentException(
                "Cannot infer SQL dialect from '" + jdbcUrl + "', set consumer.sql-dialect");
    }
}
