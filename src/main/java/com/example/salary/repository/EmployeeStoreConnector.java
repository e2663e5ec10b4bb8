package com.example.salary.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Opens sessions against the employee store.
 */
@Component
@Slf4j
public class EmployeeStoreConnector {

    private final DataSource dataSource;
    private final SqlTemplateLoader sqlLoader;
    private final int maxRetries;
    private final long retryDelayMs;

    public EmployeeStoreConnector(
            DataSource dataSource,
            SqlTemplateLoader sqlLoader,
            @Value("${app.db.max-retries:0}") int maxRetries,
            @Value("${app.db.retry-delay-ms:100}") long retryDelayMs) {
        this.dataSource = dataSource;
        this.sqlLoader = sqlLoader;
        this.maxRetries = maxRetries;
        this.retryDelayMs = retryDelayMs;
        log.info("EmployeeStoreConnector initialized with maxRetries: {}, retryDelayMs: {}ms",
                maxRetries, retryDelayMs);
    }

    /**
     * Borrow one connection from the data source.
     *
     * @return an open session, or empty when the store cannot be reached
     */
    public Optional<EmployeeStoreSession> connect() {
        Connection connection;
        try {
            connection = dataSource.getConnection();
        } catch (SQLException | RuntimeException e) {
            // pooled data sources report a failed first connect as an unchecked exception
            log.error("Error connecting to database: {}", e.getMessage());
            return Optional.empty();
        }
        log.info("Successfully connected to database");
        return Optional.of(new EmployeeStoreSession(connection, sqlLoader, maxRetries, retryDelayMs));
    }
}
