package com.example.salary.config;

import com.example.salary.model.NewEmployee;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.nio.file.Path;

/**
 * Binds the {@code app.output.*} and {@code app.enrollment.*} properties.
 */
@Configuration
@Slf4j
public class SalaryRunConfig {

    @Bean
    public SalaryRunSettings salaryRunSettings(
            @Value("${app.output.slip-dir:salary_slips}") String slipDir,
            @Value("${app.output.report-file:complete_salary_report.csv}") String reportFile,
            @Value("${app.enrollment.enabled:false}") boolean enrollmentEnabled,
            @Value("${app.enrollment.name:}") String name,
            @Value("${app.enrollment.basic-salary:0.00}") BigDecimal basicSalary,
            @Value("${app.enrollment.bonus-percentage:0.00}") BigDecimal bonusPercentage,
            @Value("${app.enrollment.tax-percentage:0.00}") BigDecimal taxPercentage) {

        NewEmployee newEmployee = null;
        if (enrollmentEnabled) {
            if (name.isBlank()) {
                log.warn("app.enrollment.enabled is set but app.enrollment.name is empty; no employee will be added");
            } else {
                newEmployee = new NewEmployee(name, basicSalary, bonusPercentage, taxPercentage);
            }
        }

        log.info("Salary run output: slips={}, report={}, enrollment={}",
                slipDir, reportFile, newEmployee != null ? newEmployee.name() : "OFF");
        return new SalaryRunSettings(Path.of(slipDir), Path.of(reportFile), newEmployee);
    }
}
