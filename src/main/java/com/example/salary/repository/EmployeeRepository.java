package com.example.salary.repository;

import com.example.salary.model.Employee;
import com.example.salary.model.NewEmployee;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Reads and inserts rows of the employees table.
 *
 * Bound to the template of one {@link EmployeeStoreSession}, so every call runs on the
 * session's connection.
 */
@Slf4j
public class EmployeeRepository {

    private static final String ID_COLUMN = "employee_id";

    private static final RowMapper<Employee> EMPLOYEE_ROW_MAPPER = (rs, rowNum) -> new Employee(
            rs.getLong("employee_id"),
            rs.getString("name"),
            rs.getBigDecimal("basic_salary"),
            percentage(rs.getBigDecimal("bonus_percentage")),
            percentage(rs.getBigDecimal("tax_percentage"))
    );

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final int maxRetries;
    private final long retryDelayMs;
    private final SqlTemplateLoader sqlLoader;

    public EmployeeRepository(
            NamedParameterJdbcTemplate jdbcTemplate,
            int maxRetries,
            long retryDelayMs,
            SqlTemplateLoader sqlLoader) {
        this.jdbcTemplate = jdbcTemplate;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryDelayMs = retryDelayMs;
        this.sqlLoader = sqlLoader;
    }

    /**
     * All employees ordered by id.
     */
    public List<Employee> findAllEmployees() {
        return withRetry("findAllEmployees", () ->
                jdbcTemplate.query(sqlLoader.load("findAllEmployees"), EMPLOYEE_ROW_MAPPER));
    }

    /**
     * Insert one employee and return the id assigned by the store.
     * Not retried: a failed attempt may already have inserted the row.
     */
    public long insertEmployee(NewEmployee employee) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("name", employee.name())
                .addValue("basicSalary", employee.basicSalary())
                .addValue("bonusPercentage", employee.bonusPercentage())
                .addValue("taxPercentage", employee.taxPercentage());

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(sqlLoader.load("insertEmployee"), params, keyHolder, new String[] {ID_COLUMN});

        return generatedId(keyHolder, employee);
    }

    // drivers name the key column differently (EMPLOYEE_ID, GENERATED_KEY, ...)
    private static long generatedId(KeyHolder keyHolder, NewEmployee employee) {
        Map<String, Object> keys = keyHolder.getKeys();
        if (keys == null || keys.isEmpty()) {
            throw new DataRetrievalFailureException("No generated id returned for employee " + employee.name());
        }
        Object key = keys.entrySet().stream()
                .filter(entry -> ID_COLUMN.equalsIgnoreCase(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseGet(() -> keys.values().iterator().next());
        if (!(key instanceof Number number)) {
            throw new DataRetrievalFailureException("Generated id for employee " + employee.name() + " is not numeric: " + key);
        }
        return number.longValue();
    }

    // the schema defaults both rates to 0.00 but does not forbid an explicit NULL
    private static BigDecimal percentage(BigDecimal value) {
        return value == null ? BigDecimal.ZERO.setScale(2) : value;
    }

    /**
     * Retry wrapper for transient DB failures.
     * Retries up to `maxRetries` times with exponential backoff and jitter; 0 disables retries.
     */
    private <T> T withRetry(String operationName, Supplier<T> operation) {
        int attempt = 0;
        final int totalAttempts = maxRetries + 1;
        while (true) {
            try {
                attempt++;
                return operation.get();
            } catch (DataAccessException e) {
                if (attempt > maxRetries) {
                    if (maxRetries > 0) {
                        log.error("Operation '{}' failed after {} attempts: {}",
                                operationName, attempt, e.getMessage());
                    }
                    throw e;
                }

                long baseDelay = retryDelayMs * (1L << (attempt - 1));
                long jitter = baseDelay > 0 ? ThreadLocalRandom.current().nextLong(0, Math.min(1000L, baseDelay)) : 0L;
                long delay = Math.min(baseDelay + jitter, 60000L);

                log.warn("Operation '{}' failed (attempt {}/{}), retrying in {}ms: {}",
                        operationName, attempt, totalAttempts, delay, e.getMessage());
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }
}
