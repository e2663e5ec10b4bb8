package com.example.salary.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Application metrics for salary runs.
 *
 * Key metrics:
 * - salary.db.fetch          → employee query time
 * - salary.calculation.time  → derivation time
 * - salary.export.time       → slip and report writing time
 * - salary.run.total         → whole run
 * - salary.employees.fetched / salary.slips.written / salary.employees.added / salary.run.failed
 */
@Component
@Getter
public class AppMetrics {

    // ═══════════════════════════════════════════════════════════════
    // TIMERS
    // ═══════════════════════════════════════════════════════════════

    private final Timer dbFetchTimer;
    private final Timer calculationTimer;
    private final Timer exportTimer;
    private final Timer totalRunTimer;

    // ═══════════════════════════════════════════════════════════════
    // COUNTERS
    // ═══════════════════════════════════════════════════════════════

    private final Counter employeesFetchedCounter;
    private final Counter slipsWrittenCounter;
    private final Counter employeesAddedCounter;
    private final Counter failedRunsCounter;

    public AppMetrics(MeterRegistry registry) {
        this.dbFetchTimer = Timer.builder("salary.db.fetch")
                .description("Employee query time")
                .register(registry);

        this.calculationTimer = Timer.builder("salary.calculation.time")
                .description("Bonus, tax and net salary derivation time")
                .register(registry);

        this.exportTimer = Timer.builder("salary.export.time")
                .description("Salary slip and complete report writing time")
                .register(registry);

        this.totalRunTimer = Timer.builder("salary.run.total")
                .description("Total salary run time")
                .register(registry);

        this.employeesFetchedCounter = Counter.builder("salary.employees.fetched")
                .description("Employee records read from the store")
                .register(registry);

        this.slipsWrittenCounter = Counter.builder("salary.slips.written")
                .description("Salary slip files written")
                .register(registry);

        this.employeesAddedCounter = Counter.builder("salary.employees.added")
                .description("Employees inserted into the store")
                .register(registry);

        this.failedRunsCounter = Counter.builder("salary.run.failed")
                .description("Runs aborted before completion")
                .register(registry);
    }

    public void recordDbFetchTime(long millis) {
        dbFetchTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordCalculationTime(long millis) {
        calculationTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordExportTime(long millis) {
        exportTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordTotalRunTime(long millis) {
        totalRunTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementEmployeesFetched(int count) {
        employeesFetchedCounter.increment(count);
    }

    public void incrementSlipsWritten() {
        slipsWrittenCounter.increment();
    }

    public void incrementEmployeesAdded() {
        employeesAddedCounter.increment();
    }

    public void incrementFailedRuns() {
        failedRunsCounter.increment();
    }
}
