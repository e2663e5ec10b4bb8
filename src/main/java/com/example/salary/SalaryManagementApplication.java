package com.example.salary;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Employee Salary Management.
 *
 * Runs one salary pass against the configured store and exits; the exit code is 0 when the
 * run completed and 1 when it aborted.
 */
@SpringBootApplication
public class SalaryManagementApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SalaryManagementApplication.class, args)));
    }
}
