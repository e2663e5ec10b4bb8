package com.example.salary.service.reporting;

import org.springframework.stereotype.Component;

import java.io.PrintStream;

/**
 * Writes progress to standard output.
 */
@Component
public class ConsoleProgressReporter implements ProgressReporter {

    private final PrintStream out;

    public ConsoleProgressReporter() {
        this(System.out);
    }

    ConsoleProgressReporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void step(int number, String description) {
        out.println();
        out.println(number + ". " + description);
    }

    @Override
    public void message(String text) {
        out.println(text);
    }

    @Override
    public void block(String text) {
        out.print(text);
        out.flush();
    }
}
