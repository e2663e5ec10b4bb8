package com.example.salary.service.export;

import com.example.salary.config.AppMetrics;
import com.example.salary.model.EmployeeSalary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes salary slips (one CSV per employee) and the complete salary report (one CSV for all).
 *
 * Existing files are truncated and rewritten. Slips are written in input order and the first
 * failure stops the loop; slips written before it stay on disk.
 */
@Service
@Slf4j
public class SalaryExportService {

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final List<String> SLIP_HEADER = List.of(
            "Employee ID", "Name", "Basic Salary", "Bonus Percentage", "Bonus Amount",
            "Tax Percentage", "Tax Amount", "Net Salary", "Generated Date");

    static final List<String> REPORT_HEADER = List.of(
            "employee_id", "name", "basic_salary", "bonus_percentage", "tax_percentage",
            "bonus", "tax", "net_salary", "report_generated");

    private final Clock clock;
    private final AppMetrics metrics;

    public SalaryExportService(Clock clock, AppMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    public static String slipFileName(long employeeId) {
        return "salary_slip_" + employeeId + ".csv";
    }

    /**
     * Write {@code salary_slip_<id>.csv} for every employee into {@code outputDir}.
     *
     * @return true when every slip was written
     */
    public boolean generateSalarySlips(@Nullable List<EmployeeSalary> salaries, Path outputDir) {
        if (salaries == null) {
            log.error("No employee data available for salary slip generation");
            return false;
        }

        try {
            if (!Files.isDirectory(outputDir)) {
                Files.createDirectories(outputDir);
                log.info("Created directory: {}", outputDir);
            }

            for (EmployeeSalary salary : salaries) {
                String fileName = slipFileName(salary.employeeId());
                List<List<String>> rows = List.of(SLIP_HEADER, slipRow(salary, now()));
                write(outputDir.resolve(fileName), rows);
                metrics.incrementSlipsWritten();
                log.info("Generated salary slip: {}", fileName);
            }

            log.info("All salary slips generated successfully in '{}' directory", outputDir);
            return true;
        } catch (IOException e) {
            log.error("Error generating salary slips: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Write every employee plus a {@code report_generated} column into a single CSV.
     *
     * @return true when the report was written
     */
    public boolean exportCompleteReport(@Nullable List<EmployeeSalary> salaries, Path reportFile) {
        if (salaries == null) {
            log.error("No employee data available for export");
            return false;
        }

        String generated = now();
        List<List<String>> rows = new ArrayList<>(salaries.size() + 1);
        rows.add(REPORT_HEADER);
        for (EmployeeSalary salary : salaries) {
            rows.add(reportRow(salary, generated));
        }

        try {
            Path parent = reportFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            write(reportFile, rows);
            log.info("Complete salary report exported to: {}", reportFile);
            return true;
        } catch (IOException e) {
            log.error("Error exporting complete report: {}", e.getMessage());
            return false;
        }
    }

    static List<String> slipRow(EmployeeSalary salary, String generatedDate) {
        return List.of(
                Long.toString(salary.employeeId()),
                salary.name(),
                amount(salary.basicSalary()),
                percentage(salary.bonusPercentage()),
                amount(salary.bonus()),
                percentage(salary.taxPercentage()),
                amount(salary.tax()),
                amount(salary.netSalary()),
                generatedDate);
    }

    static List<String> reportRow(EmployeeSalary salary, String reportGenerated) {
        return List.of(
                Long.toString(salary.employeeId()),
                salary.name(),
                amount(salary.basicSalary()),
                salary.bonusPercentage().toPlainString(),
                salary.taxPercentage().toPlainString(),
                amount(salary.bonus()),
                amount(salary.tax()),
                amount(salary.netSalary()),
                reportGenerated);
    }

    private String now() {
        return LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
    }

    private static void write(Path file, List<List<String>> rows) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            CsvWriter csv = new CsvWriter(writer);
            for (List<String> row : rows) {
                csv.writeRow(row);
            }
        }
    }

    private static String amount(BigDecimal value) {
        return value.toPlainString();
    }

    private static String percentage(BigDecimal value) {
        return value.toPlainString() + "%";
    }
}
