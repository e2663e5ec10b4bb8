package com.example.salary.model;

import java.math.BigDecimal;

/**
 * Input for inserting an employee. The store assigns the id.
 */
public record NewEmployee(
    String name,
    BigDecimal basicSalary,
    BigDecimal bonusPercentage,
    BigDecimal taxPercentage
) {}
