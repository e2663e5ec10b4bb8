package com.example.salary.service;

import com.example.salary.config.AppMetrics;
import com.example.salary.config.RunContextManager;
import com.example.salary.config.SalaryRunSettings;
import com.example.salary.model.Employee;
import com.example.salary.model.EmployeeSalary;
import com.example.salary.model.FailureKind;
import com.example.salary.model.NewEmployee;
import com.example.salary.model.SalaryRunResult;
import com.example.salary.model.SalaryRunResult.TimingBreakdown;
import com.example.salary.repository.EmployeeStoreConnector;
import com.example.salary.repository.EmployeeStoreSession;
import com.example.salary.service.enrollment.EmployeeEnrollmentService;
import com.example.salary.service.export.SalaryExportService;
import com.example.salary.service.processing.SalaryCalculationService;
import com.example.salary.service.reporting.ProgressReporter;
import com.example.salary.service.reporting.SalaryReportService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Runs one salary pass: connect, fetch, calculate, print, export, then add the configured
 * employee.
 *
 * A failed connect, fetch or calculation ends the run early; nothing is exported and no
 * employee is added. Export and insert failures are logged and the run goes on. The store
 * connection is released on every path.
 */
@Service
@Slf4j
public class SalaryRunOrchestrator {

    private static final String BANNER = "=".repeat(60);

    private final EmployeeStoreConnector storeConnector;
    private final SalaryCalculationService calculationService;
    private final SalaryReportService reportService;
    private final SalaryExportService exportService;
    private final EmployeeEnrollmentService enrollmentService;
    private final ProgressReporter reporter;
    private final AppMetrics metrics;
    private final SalaryRunSettings settings;

    public SalaryRunOrchestrator(
            EmployeeStoreConnector storeConnector,
            SalaryCalculationService calculationService,
            SalaryReportService reportService,
            SalaryExportService exportService,
            EmployeeEnrollmentService enrollmentService,
            ProgressReporter reporter,
            AppMetrics metrics,
            SalaryRunSettings settings) {
        this.storeConnector = storeConnector;
        this.calculationService = calculationService;
        this.reportService = reportService;
        this.exportService = exportService;
        this.enrollmentService = enrollmentService;
        this.reporter = reporter;
        this.metrics = metrics;
        this.settings = settings;
    }

    public SalaryRunResult run() {
        String runId = RunContextManager.ensureRunId();
        long startTime = System.currentTimeMillis();
        long fetchTime = 0;
        long calculationTime = 0;
        long exportTime = 0;

        SalaryRunResult.SalaryRunResultBuilder result = SalaryRunResult.builder()
                .slipDirectory(settings.slipDirectory())
                .reportFile(settings.reportFile());

        reporter.message(BANNER);
        reporter.message("EMPLOYEE SALARY MANAGEMENT SYSTEM");
        reporter.message(BANNER);
        log.info("SALARY RUN START: runId={}", runId);

        EmployeeStoreSession session = null;
        try {
            // STAGE 1: Connect
            reporter.step(1, "Connecting to database...");
            Optional<EmployeeStoreSession> opened = storeConnector.connect();
            if (opened.isEmpty()) {
                reporter.message("Failed to connect to database. Please check your credentials.");
                return abort(result, FailureKind.CONNECTION);
            }
            session = opened.get();

            // STAGE 2: Fetch
            reporter.step(2, "Fetching employee data...");
            long fetchStart = System.currentTimeMillis();
            Optional<List<Employee>> employees = fetchEmployees(session);
            fetchTime = System.currentTimeMillis() - fetchStart;
            metrics.recordDbFetchTime(fetchTime);
            if (employees.isEmpty()) {
                reporter.message("Failed to fetch employee data.");
                return abort(result.timing(new TimingBreakdown(fetchTime, 0, 0, elapsedSince(startTime))),
                        FailureKind.QUERY);
            }
            metrics.incrementEmployeesFetched(employees.get().size());

            // STAGE 3: Calculate
            reporter.step(3, "Calculating salary components...");
            long calculationStart = System.currentTimeMillis();
            Optional<List<EmployeeSalary>> calculated = calculationService.calculate(employees.get());
            calculationTime = System.currentTimeMillis() - calculationStart;
            metrics.recordCalculationTime(calculationTime);
            if (calculated.isEmpty()) {
                reporter.message("Failed to calculate salary components.");
                return abort(result.timing(new TimingBreakdown(fetchTime, calculationTime, 0, elapsedSince(startTime))),
                        FailureKind.MISSING_DATA);
            }
            List<EmployeeSalary> salaries = calculated.get();
            result.employeeCount(salaries.size());

            // STAGE 4: Summary
            reporter.step(4, "Displaying salary summary...");
            reportService.render(salaries).ifPresent(reporter::block);

            // STAGE 5 + 6: Export
            long exportStart = System.currentTimeMillis();
            reporter.step(5, "Generating individual salary slips...");
            boolean slipsGenerated = exportService.generateSalarySlips(salaries, settings.slipDirectory());
            if (slipsGenerated) {
                reporter.message("Individual salary slips generated successfully!");
            }

            reporter.step(6, "Exporting complete salary report...");
            boolean reportExported = exportService.exportCompleteReport(salaries, settings.reportFile());
            if (reportExported) {
                reporter.message("Complete salary report exported successfully!");
            }
            exportTime = System.currentTimeMillis() - exportStart;
            metrics.recordExportTime(exportTime);
            result.slipsGenerated(slipsGenerated).reportExported(reportExported);
            if (!slipsGenerated || !reportExported) {
                result.failure(FailureKind.FILE_WRITE);
            }

            // STAGE 7: Add employee
            reporter.step(7, "Adding new employee...");
            Optional<NewEmployee> toAdd = settings.employeeToAdd();
            if (toAdd.isPresent()) {
                OptionalLong newId = enrollmentService.addEmployee(session, toAdd.get());
                if (newId.isPresent()) {
                    result.newEmployeeId(newId.getAsLong());
                    reporter.message("New employee added with ID: " + newId.getAsLong());
                } else {
                    result.failure(FailureKind.INSERT);
                }
            } else {
                reporter.message("No new employee configured, skipping.");
            }

            reporter.message("");
            reporter.message(BANNER);
            reporter.message("SYSTEM EXECUTION COMPLETED SUCCESSFULLY!");
            reporter.message(BANNER);

            long totalTime = elapsedSince(startTime);
            log.info("SALARY RUN COMPLETE | Total: {}ms | Fetch: {}ms | Calculate: {}ms | Export: {}ms | Employees: {}",
                    totalTime, fetchTime, calculationTime, exportTime, salaries.size());
            return result.completed(true)
                    .timing(new TimingBreakdown(fetchTime, calculationTime, exportTime, totalTime))
                    .build();
        } catch (RuntimeException e) {
            log.error("An error occurred during system execution: {}", e.getMessage(), e);
            return abort(result.timing(new TimingBreakdown(fetchTime, calculationTime, exportTime, elapsedSince(startTime))),
                    FailureKind.UNEXPECTED);
        } finally {
            if (session != null) {
                session.close();
            }
            metrics.recordTotalRunTime(elapsedSince(startTime));
            RunContextManager.clear();
        }
    }

    private Optional<List<Employee>> fetchEmployees(EmployeeStoreSession session) {
        try {
            List<Employee> employees = session.employees().findAllEmployees();
            log.info("Successfully fetched {} employee records", employees.size());
            return Optional.of(employees);
        } catch (DataAccessException e) {
            log.error("Error fetching employee data: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private SalaryRunResult abort(SalaryRunResult.SalaryRunResultBuilder result, FailureKind failure) {
        metrics.incrementFailedRuns();
        log.warn("SALARY RUN ABORTED: {}", failure);
        SalaryRunResult aborted = result.completed(false).failure(failure).build();
        return aborted.timing() == null ? aborted.toBuilder().timing(TimingBreakdown.NONE).build() : aborted;
    }

    private static long elapsedSince(long startMillis) {
        return System.currentTimeMillis() - startMillis;
    }
}
