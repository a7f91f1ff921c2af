package com.datasync.personconsumer.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlDialectTest {

    @Test
    void infersDialectFromJdbcUrl() {
        assertThat(SqlDialect.fromJdbcUrl("jdbc:postgresql://postgres:5432/appdb")).isEqualTo(SqlDialect.POSTGRESQL);
        assertThat(SqlDialect.fromJdbcUrl("jdbc:mysql://mysql-app:3306/appdb")).isEqualTo(SqlDialect.MYSQL);
        assertThat(SqlDialect.fromJdbcUrl("jdbc:mariadb://db:3306/appdb")).isEqualTo(SqlDialect.MYSQL);
        assertThat(SqlDialect.fromJdbcUrl("jdbc:h2:mem:test;MODE=MySQL")).isEqualTo(SqlDialect.MYSQL);
    }

    @Test
    void configuredDialectWins() {
        assertThat(SqlDialect.resolve("mysql", "jdbc:postgresql://postgres:5432/appdb")).isEqualTo(SqlDialect.MYSQL);
        assertThat(SqlDialect.resolve(" ", "jdbc:postgresql://postgres:5432/appdb")).isEqualTo(SqlDialect.POSTGRESQL);
    }

    @Test
    void unknownDialectFails() {
        assertThatThrownBy(() -> SqlDialect.resolve("oracle", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SqlDialect.fromJdbcUrl("jdbc:sqlserver://db"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("consumer.sql-dialect");
    }

    @Test
    void conflictUpdateNeverTouchesCreatedAt() {
        for (SqlDialect dialect : SqlDialect.values()) {
            String sql = dialect.upsertSql("persons");
            String updateClause = sql.substring(sql.indexOf("VALUES (?, ?, ?, ?, ?)") + 22);

            assertThat(sql).startsWith("INSERT INTO persons (id, name, email, createdAt, updatedAt)");
            assertThat(updateClause).contains("name", "email", "updatedAt").doesNotContain("createdAt");
        }
    }
}
