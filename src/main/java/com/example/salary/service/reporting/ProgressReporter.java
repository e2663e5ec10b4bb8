package com.example.salary.service.reporting;

/**
 * Operator-facing output of a salary run: step headings, outcome lines and the summary block.
 */
public interface ProgressReporter {

    void step(int number, String description);

    void message(String text);

    void block(String text);
}
