package com.example.salary.model;

import java.math.BigDecimal;

/**
 * Employee row with the derived bonus, tax and net salary.
 * Computed in memory for a single run, never written back to the store.
 */
public record EmployeeSalary(
    long employeeId,
    String name,
    BigDecimal basicSalary,
    BigDecimal bonusPercentage,
    BigDecimal taxPercentage,
    BigDecimal bonus,
    BigDecimal tax,
    BigDecimal netSalary
) {}
