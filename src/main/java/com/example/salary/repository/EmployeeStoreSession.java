package com.example.salary.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.Connection;

/**
 * One open connection to the employee store.
 *
 * The fetch and the insert of a run share this connection. Closing the session releases it;
 * a second close does nothing.
 */
@Slf4j
public final class EmployeeStoreSession implements AutoCloseable {

    private final SingleConnectionDataSource dataSource;
    private final EmployeeRepository employees;
    private boolean closed;

    EmployeeStoreSession(Connection connection, SqlTemplateLoader sqlLoader, int maxRetries, long retryDelayMs) {
        this.dataSource = new SingleConnectionDataSource(connection, true);
        this.employees = new EmployeeRepository(
                new NamedParameterJdbcTemplate(dataSource), maxRetries, retryDelayMs, sqlLoader);
    }

    public EmployeeRepository employees() {
        if (closed) {
            throw new IllegalStateException("Employee store session is closed");
        }
        return employees;
    }

    public boolean isOpen() {
        return !closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        dataSource.destroy();
        log.info("Database connection closed");
    }
}
