package com.eyelevel.flambientprocessor.cli;

/**
 * Operator-facing output and prompts, kept apart from logging.
 */
public interface OperatorConsole {

    void info(String message);

    void note(String message);

    void warn(String message);

    void error(String message);

    /**
     * Asks a yes/no question.
     *
     * @return the answer, or {@code defaultAnswer} when the operator just presses enter or no input
     *         is available.
     */
    boolean confirm(String question, boolean defaultAnswer);
}
