package com.example.salary.service.enrollment;

import com.example.salary.config.AppMetrics;
import com.example.salary.model.NewEmployee;
import com.example.salary.repository.EmployeeStoreSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.OptionalLong;

/**
 * Adds employees to the store. Input ranges are left to the store to enforce.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EmployeeEnrollmentService {

    private final AppMetrics metrics;

    /**
     * Insert a new employee on the session's connection.
     *
     * @return the id assigned by the store, or empty when the insert failed
     */
    public OptionalLong addEmployee(EmployeeStoreSession session, NewEmployee employee) {
        try {
            long employeeId = session.employees().insertEmployee(employee);
            metrics.incrementEmployeesAdded();
            log.info("New employee added successfully with ID: {}", employeeId);
            return OptionalLong.of(employeeId);
        } catch (DataAccessException | IllegalStateException e) {
            log.error("Error adding new employee: {}", e.getMessage());
            return OptionalLong.empty();
        }
    }
}
