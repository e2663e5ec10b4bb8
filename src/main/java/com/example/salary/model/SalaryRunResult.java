package com.example.salary.model;

import lombok.Builder;

import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Outcome of one salary run with a timing breakdown for each stage.
 *
 * A run is completed when it got past the calculation stage. Slip and report export
 * failures are recorded in their flags but do not abort the run.
 */
@Builder(toBuilder = true)
public record SalaryRunResult(
        boolean completed,
        FailureKind failure,
        int employeeCount,
        boolean slipsGenerated,
        boolean reportExported,
        Path slipDirectory,
        Path reportFile,
        Long newEmployeeId,
        TimingBreakdown timing
) {

    public Optional<FailureKind> failureKind() {
        return Optional.ofNullable(failure);
    }

    public OptionalLong addedEmployeeId() {
        return newEmployeeId == null ? OptionalLong.empty() : OptionalLong.of(newEmployeeId);
    }

    /**
     * Milliseconds spent in each stage.
     */
    public record TimingBreakdown(
            long fetchMs,
            long calculationMs,
            long exportMs,
            long totalMs
    ) {
        public static final TimingBreakdown NONE = new TimingBreakdown(0, 0, 0, 0);
    }
}
