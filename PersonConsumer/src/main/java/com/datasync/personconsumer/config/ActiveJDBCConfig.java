package com.datasync.personconsumer.config;

import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * ActiveJDBC Database Configuration
 *
 * Binds ActiveJDBC to the pooled DataSource auto-configured by Spring Boot.
 * Each unit of work borrows one pooled connection for the current thread
 * with {@link #openConnection()} and returns it with {@link #closeConnection()}.
 * The pool is drained on shutdown.
 */
@Configuration
@Slf4j
public class ActiveJDBCConfig {

    private final DataSource dataSource;

    public ActiveJDBCConfig(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Borrows a pooled connection for the current thread.
     */
    public void openConnection() {
        if (!Base.hasConnection()) {
            Base.open(dataSource);
        }
    }

    /**
     * Returns the current thread's connection to the pool.
     */
    public void closeConnection() {
        if (Base.hasConnection()) {
            Base.close();
        }
    }

    @PreDestroy
    public void drainPool() {
        if (dataSource instanceof HikariDataSource) {
            HikariDataSource pool = (HikariDataSource) dataSource;
            try {
                if (!pool.isClosed()) {
                    pool.close();
                    log.info("Database connection pool drained");
                }
            } catch (Exception e) {
                log.warn("Error draining database connection pool: {}", e.getMessage());
            }
        }
    }

}
