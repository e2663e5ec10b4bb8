package com.example.salary.service.export;

import com.example.salary.config.AppMetrics;
import com.example.salary.model.EmployeeSalary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class SalaryExportServiceTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-03-14T09:26:53Z"), ZoneOffset.UTC);
    private static final Clock LATER_CLOCK = Clock.fixed(Instant.parse("2025-03-15T18:00:01Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private AppMetrics metrics;
    private SalaryExportService exportService;

    private final List<EmployeeSalary> salaries = List.of(
            salary(1, "John Smith", "50000.00", "10.00", "15.00", "5000.00", "7500.00", "47500.00"),
            salary(2, "Sarah Johnson", "60000.00", "12.00", "18.00", "7200.00", "10800.00", "56400.00"),
            salary(11, "Alex Johnson", "62000.00", "14.00", "19.00", "8680.00", "11780.00", "58900.00"));

    @BeforeEach
    void setUp() {
        metrics = new AppMetrics(new SimpleMeterRegistry());
        exportService = new SalaryExportService(FIXED_CLOCK, metrics);
    }

    @Nested
    @DisplayName("Salary slips")
    class SalarySlips {

        @Test
        @DisplayName("Should write one slip per employee named by id")
        void shouldWriteOneSlipPerEmployee() throws IOException {
            Path slipDir = tempDir.resolve("salary_slips");

            boolean written = exportService.generateSalarySlips(salaries, slipDir);

            assertThat(written).isTrue();
            try (Stream<Path> files = Files.list(slipDir)) {
                assertThat(files.map(p -> p.getFileName().toString()))
                        .containsExactlyInAnyOrder("salary_slip_1.csv", "salary_slip_2.csv", "salary_slip_11.csv");
            }
            assertThat(metrics.getSlipsWrittenCounter().count()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("Should write the slip header and a row with percentage signs")
        void shouldWriteSlipContent() throws IOException {
            Path slipDir = tempDir.resolve("salary_slips");

            exportService.generateSalarySlips(salaries, slipDir);

            List<String> lines = Files.readAllLines(slipDir.resolve("salary_slip_1.csv"), StandardCharsets.UTF_8);
            assertThat(lines).containsExactly(
                    "Employee ID,Name,Basic Salary,Bonus Percentage,Bonus Amount,Tax Percentage,Tax Amount,Net Salary,Generated Date",
                    "1,John Smith,50000.00,10.00%,5000.00,15.00%,7500.00,47500.00,2025-03-14 09:26:53");
        }

        @Test
        @DisplayName("Should overwrite an existing slip instead of appending")
        void shouldOverwriteExistingSlip() throws IOException {
            Path slipDir = Files.createDirectories(tempDir.resolve("salary_slips"));
            Files.writeString(slipDir.resolve("salary_slip_1.csv"), "stale\nstale\nstale\nstale\n");

            exportService.generateSalarySlips(salaries, slipDir);

            assertThat(Files.readAllLines(slipDir.resolve("salary_slip_1.csv"))).hasSize(2)
                    .noneMatch(line -> line.contains("stale"));
        }

        @Test
        @DisplayName("Should fail when the output directory is a regular file")
        void shouldFailWhenDirectoryIsAFile() throws IOException {
            Path notADirectory = Files.writeString(tempDir.resolve("salary_slips"), "occupied");

            assertThat(exportService.generateSalarySlips(salaries, notADirectory)).isFalse();
            assertThat(metrics.getSlipsWrittenCounter().count()).isZero();
        }

        @Test
        @DisplayName("Should keep slips written before a failure")
        void shouldKeepSlipsWrittenBeforeFailure() throws IOException {
            Path slipDir = Files.createDirectories(tempDir.resolve("salary_slips"));
            // a directory where the second slip should go makes that write fail
            Files.createDirectory(slipDir.resolve("salary_slip_2.csv"));

            boolean written = exportService.generateSalarySlips(salaries, slipDir);

            assertThat(written).isFalse();
            assertThat(slipDir.resolve("salary_slip_1.csv")).isRegularFile();
            assertThat(slipDir.resolve("salary_slip_11.csv")).doesNotExist();
        }

        @Test
        @DisplayName("Should write nothing for absent data")
        void shouldRejectAbsentData() {
            Path slipDir = tempDir.resolve("salary_slips");

            assertThat(exportService.generateSalarySlips(null, slipDir)).isFalse();
            assertThat(slipDir).doesNotExist();
        }

        @Test
        @DisplayName("Should create the directory even for an empty set")
        void shouldCreateDirectoryForEmptySet() {
            Path slipDir = tempDir.resolve("nested").resolve("salary_slips");

            assertThat(exportService.generateSalarySlips(List.of(), slipDir)).isTrue();
            assertThat(slipDir).isEmptyDirectory();
        }
    }

    @Nested
    @DisplayName("Complete report")
    class CompleteReport {

        @Test
        @DisplayName("Should write a header plus one row per employee")
        void shouldWriteReport() throws IOException {
            Path report = tempDir.resolve("complete_salary_report.csv");

            assertThat(exportService.exportCompleteReport(salaries, report)).isTrue();

            List<String> lines = Files.readAllLines(report);
            assertThat(lines).hasSize(salaries.size() + 1);
            assertThat(lines.get(0)).isEqualTo(
                    "employee_id,name,basic_salary,bonus_percentage,tax_percentage,bonus,tax,net_salary,report_generated");
            assertThat(lines.get(3)).isEqualTo(
                    "11,Alex Johnson,62000.00,14.00,19.00,8680.00,11780.00,58900.00,2025-03-14 09:26:53");
        }

        @Test
        @DisplayName("Should produce byte-identical output for the same input and clock")
        void shouldBeIdempotent() throws IOException {
            Path report = tempDir.resolve("complete_salary_report.csv");

            exportService.exportCompleteReport(salaries, report);
            byte[] first = Files.readAllBytes(report);
            exportService.exportCompleteReport(salaries, report);

            assertThat(Files.readAllBytes(report)).isEqualTo(first);
        }

        @Test
        @DisplayName("Should differ only in the timestamp column when the clock moves")
        void shouldDifferOnlyInTimestamp() throws IOException {
            Path first = tempDir.resolve("first.csv");
            Path second = tempDir.resolve("second.csv");

            exportService.exportCompleteReport(salaries, first);
            new SalaryExportService(LATER_CLOCK, metrics).exportCompleteReport(salaries, second);

            List<String> firstLines = Files.readAllLines(first);
            List<String> secondLines = Files.readAllLines(second);
            assertThat(secondLines).hasSameSizeAs(firstLines);
            assertThat(secondLines.get(0)).isEqualTo(firstLines.get(0));
            for (int i = 1; i < firstLines.size(); i++) {
                assertThat(withoutLastColumn(secondLines.get(i))).isEqualTo(withoutLastColumn(firstLines.get(i)));
                assertThat(secondLines.get(i)).endsWith("2025-03-15 18:00:01");
            }
        }

        @Test
        @DisplayName("Should quote names containing the delimiter")
        void shouldQuoteNames() throws IOException {
            Path report = tempDir.resolve("complete_salary_report.csv");
            List<EmployeeSalary> quoted = List.of(
                    salary(5, "Smith, John \"JJ\"", "100.00", "0.00", "0.00", "0.00", "0.00", "100.00"));

            exportService.exportCompleteReport(quoted, report);

            assertThat(Files.readAllLines(report).get(1))
                    .startsWith("5,\"Smith, John \"\"JJ\"\"\",100.00,");
        }

        @Test
        @DisplayName("Should create missing parent directories")
        void shouldCreateParentDirectories() {
            Path report = tempDir.resolve("reports").resolve("2025").resolve("complete_salary_report.csv");

            assertThat(exportService.exportCompleteReport(salaries, report)).isTrue();
            assertThat(report).isRegularFile();
        }

        @Test
        @DisplayName("Should write nothing for absent data")
        void shouldRejectAbsentData() {
            Path report = tempDir.resolve("complete_salary_report.csv");

            assertThat(exportService.exportCompleteReport(null, report)).isFalse();
            assertThat(report).doesNotExist();
        }

        @Test
        @DisplayName("Should write only the header for an empty set")
        void shouldWriteHeaderForEmptySet() throws IOException {
            Path report = tempDir.resolve("complete_salary_report.csv");

            exportService.exportCompleteReport(List.of(), report);

            assertThat(Files.readAllLines(report)).hasSize(1);
        }
    }

    private static String withoutLastColumn(String line) {
        return line.substring(0, line.lastIndexOf(','));
    }

    private static EmployeeSalary salary(long id, String name, String basic, String bonusPct, String taxPct,
                                         String bonus, String tax, String net) {
        return new EmployeeSalary(id, name, new BigDecimal(basic), new BigDecimal(bonusPct), new BigDecimal(taxPct),
                new BigDecimal(bonus), new BigDecimal(tax), new BigDecimal(net));
    }
}
