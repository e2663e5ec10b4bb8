package com.example.salary.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Aggregate figures over a derived record set.
 * averageNetSalary is empty when there are no employees.
 */
public record SalaryStatistics(
    int employeeCount,
    BigDecimal totalBasicSalary,
    BigDecimal totalBonus,
    BigDecimal totalTax,
    BigDecimal totalNetSalary,
    Optional<BigDecimal> averageNetSalary
) {}
