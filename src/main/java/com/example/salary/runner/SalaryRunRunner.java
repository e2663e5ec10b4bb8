package com.example.salary.runner;

import com.example.salary.model.SalaryRunResult;
import com.example.salary.service.SalaryRunOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts the salary run once the application context is up.
 * Disable with {@code app.runner.enabled=false}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.runner.enabled", havingValue = "true", matchIfMissing = true)
public class SalaryRunRunner implements ApplicationRunner, ExitCodeGenerator {

    private final SalaryRunOrchestrator orchestrator;
    private volatile SalaryRunResult lastResult;

    @Override
    public void run(ApplicationArguments args) {
        lastResult = orchestrator.run();
        lastResult.failureKind().ifPresent(failure ->
                log.warn("Salary run finished with failure: {} (completed={})", failure, lastResult.completed()));
    }

    @Override
    public int getExitCode() {
        return lastResult == null || lastResult.completed() ? 0 : 1;
    }
}
