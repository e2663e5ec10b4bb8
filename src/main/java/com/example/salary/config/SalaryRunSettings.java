package com.example.salary.config;

import com.example.salary.model.NewEmployee;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Where a run writes its files, and which employee (if any) it adds at the end.
 */
public record SalaryRunSettings(
        Path slipDirectory,
        Path reportFile,
        NewEmployee newEmployee
) {

    public Optional<NewEmployee> employeeToAdd() {
        return Optional.ofNullable(newEmployee);
    }
}
