package com.example.salary.model;

import java.math.BigDecimal;

/**
 * Employee compensation row as stored in the employees table.
 */
public record Employee(
    long employeeId,
    String name,
    BigDecimal basicSalary,
    BigDecimal bonusPercentage,
    BigDecimal taxPercentage
) {}
