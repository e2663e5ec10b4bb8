package com.example.salary.service.processing;

import com.example.salary.model.Employee;
import com.example.salary.model.EmployeeSalary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Derives bonus, tax and net salary for each employee.
 *
 * Percentages are not range-checked: a negative salary or a rate above 100 simply produces
 * the matching signed or oversized amounts.
 */
@Service
@Slf4j
public class SalaryCalculationService {

    static final int SCALE = 2;
    static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    /**
     * Derive salary components for every employee, keeping the input order.
     *
     * @param employees fetched employees; null when nothing was fetched
     * @return derived records, or empty when there is no employee data
     */
    public Optional<List<EmployeeSalary>> calculate(@Nullable List<Employee> employees) {
        if (employees == null) {
            log.error("No employee data available. Please fetch data first.");
            return Optional.empty();
        }

        List<EmployeeSalary> derived = employees.stream()
                .map(SalaryCalculationService::derive)
                .toList();

        log.info("Salary components calculated successfully for {} employees", derived.size());
        return Optional.of(derived);
    }

    /**
     * Pure calculation for a single employee.
     * Net salary is taken from the exact bonus and tax, then rounded once.
     */
    public static EmployeeSalary derive(Employee employee) {
        BigDecimal basic = employee.basicSalary();
        BigDecimal exactBonus = percentOf(basic, employee.bonusPercentage());
        BigDecimal exactTax = percentOf(basic, employee.taxPercentage());
        BigDecimal exactNet = basic.add(exactBonus).subtract(exactTax);

        return new EmployeeSalary(
                employee.employeeId(),
                employee.name(),
                basic,
                employee.bonusPercentage(),
                employee.taxPercentage(),
                round(exactBonus),
                round(exactTax),
                round(exactNet)
        );
    }

    private static BigDecimal percentOf(BigDecimal amount, BigDecimal percentage) {
        return amount.multiply(percentage).movePointLeft(2);
    }

    private static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, ROUNDING);
    }
}
