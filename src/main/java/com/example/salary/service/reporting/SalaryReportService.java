package com.example.salary.service.reporting;

import com.example.salary.model.EmployeeSalary;
import com.example.salary.model.SalaryStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builds the salary summary: a fixed-width table of all employees followed by totals.
 */
@Service
@Slf4j
public class SalaryReportService {

    static final String NOT_AVAILABLE = "N/A";
    private static final int RULE_WIDTH = 80;
    private static final String RULE = "=".repeat(RULE_WIDTH);

    private static final List<Column> COLUMNS = List.of(
            new Column("employee_id", s -> Long.toString(s.employeeId()), false),
            new Column("name", EmployeeSalary::name, true),
            new Column("basic_salary", s -> plain(s.basicSalary()), false),
            new Column("bonus_percentage", s -> plain(s.bonusPercentage()), false),
            new Column("tax_percentage", s -> plain(s.taxPercentage()), false),
            new Column("bonus", s -> plain(s.bonus()), false),
            new Column("tax", s -> plain(s.tax()), false),
            new Column("net_salary", s -> plain(s.netSalary()), false)
    );

    /**
     * Totals and average net salary. The average is empty for an empty set.
     */
    public SalaryStatistics summarize(List<EmployeeSalary> salaries) {
        BigDecimal basic = sum(salaries, EmployeeSalary::basicSalary);
        BigDecimal bonus = sum(salaries, EmployeeSalary::bonus);
        BigDecimal tax = sum(salaries, EmployeeSalary::tax);
        BigDecimal net = sum(salaries, EmployeeSalary::netSalary);

        Optional<BigDecimal> average = salaries.isEmpty()
                ? Optional.empty()
                : Optional.of(net.divide(BigDecimal.valueOf(salaries.size()), 2, RoundingMode.HALF_UP));

        return new SalaryStatistics(salaries.size(), basic, bonus, tax, net, average);
    }

    /**
     * Render the summary table and statistics.
     *
     * @return the text block, or empty when there is no data to show
     */
    public Optional<String> render(@Nullable List<EmployeeSalary> salaries) {
        if (salaries == null) {
            log.error("No employee data available");
            return Optional.empty();
        }

        StringBuilder out = new StringBuilder();
        out.append('\n').append(RULE).append('\n');
        out.append("EMPLOYEE SALARY SUMMARY").append('\n');
        out.append(RULE).append('\n');
        appendTable(out, salaries);
        out.append(RULE).append('\n');

        SalaryStatistics stats = summarize(salaries);
        out.append('\n').append("SALARY STATISTICS:").append('\n');
        out.append("Total Employees: ").append(stats.employeeCount()).append('\n');
        out.append("Total Basic Salary: ").append(money(stats.totalBasicSalary())).append('\n');
        out.append("Total Bonus: ").append(money(stats.totalBonus())).append('\n');
        out.append("Total Tax: ").append(money(stats.totalTax())).append('\n');
        out.append("Total Net Salary: ").append(money(stats.totalNetSalary())).append('\n');
        out.append("Average Net Salary: ")
                .append(stats.averageNetSalary().map(SalaryReportService::money).orElse(NOT_AVAILABLE))
                .append('\n');
        out.append(RULE).append('\n');
        return Optional.of(out.toString());
    }

    /**
     * US-grouped currency with two decimals, e.g. {@code $1,234.50} or {@code -$5.00}.
     */
    static String money(BigDecimal amount) {
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.US));
        format.setRoundingMode(RoundingMode.HALF_UP);
        String digits = format.format(amount.abs());
        return amount.signum() < 0 ? "-$" + digits : "$" + digits;
    }

    private static void appendTable(StringBuilder out, List<EmployeeSalary> salaries) {
        List<String[]> cells = new ArrayList<>(salaries.size());
        int[] widths = new int[COLUMNS.size()];
        for (int c = 0; c < COLUMNS.size(); c++) {
            widths[c] = COLUMNS.get(c).header().length();
        }
        for (EmployeeSalary salary : salaries) {
            String[] row = new String[COLUMNS.size()];
            for (int c = 0; c < COLUMNS.size(); c++) {
                row[c] = String.valueOf(COLUMNS.get(c).value().apply(salary));
                widths[c] = Math.max(widths[c], row[c].length());
            }
            cells.add(row);
        }

        String[] headers = COLUMNS.stream().map(Column::header).toArray(String[]::new);
        appendRow(out, headers, widths);
        for (String[] row : cells) {
            appendRow(out, row, widths);
        }
    }

    private static void appendRow(StringBuilder out, String[] row, int[] widths) {
        for (int c = 0; c < row.length; c++) {
            if (c > 0) {
                out.append("  ");
            }
            String format = COLUMNS.get(c).leftAligned() ? "%-" + widths[c] + "s" : "%" + widths[c] + "s";
            out.append(String.format(format, row[c]));
        }
        // trailing padding of a left-aligned last column is noise
        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == ' ') {
            end--;
        }
        out.setLength(end);
        out.append('\n');
    }

    private static BigDecimal sum(List<EmployeeSalary> salaries, Function<EmployeeSalary, BigDecimal> field) {
        return salaries.stream()
                .map(field)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }

    private static String plain(BigDecimal value) {
        return value == null ? "" : value.toPlainString();
    }

    private record Column(String header, Function<EmployeeSalary, String> value, boolean leftAligned) {}
}
