package com.eyelevel.flambientprocessor.cli;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Prints to the terminal and reads yes/no answers from standard input.
 */
@Slf4j
@Component
public class TerminalOperatorConsole implements OperatorConsole {

    private final PrintStream out;
    private final PrintStream err;
    private final BufferedReader in;

    @Autowired
    public TerminalOperatorConsole() {
        this(System.out, System.err, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    TerminalOperatorConsole(PrintStream out, PrintStream err, BufferedReader in) {
        this.out = out;
        this.err = err;
        this.in = in;
    }

    @Override
    public void info(String message) {
        out.println(message);
    }

    @Override
    public void note(String message) {
        out.println("  " + message);
    }

    @Override
    public void warn(String message) {
        out.println("WARNING: " + message);
    }

    @Override
    public void error(String message) {
        err.println("ERROR: " + message);
    }

    @Override
    public boolean confirm(String question, boolean defaultAnswer) {
        out.print(question + (defaultAnswer ? " [Y/n] " : " [y/N] "));
        out.flush();
        try {
            String answer = in.readLine();
            if (answer == null || answer.isBlank()) {
                return defaultAnswer;
            }
            String normalized = answer.trim().toLowerCase(Locale.ROOT);
            return normalized.equals("y") || normalized.equals("yes");
        } catch (IOException e) {
            log.warn("Could not read the answer, using the default ({})", defaultAnswer, e);
            return defaultAnswer;
        }
    }
}
