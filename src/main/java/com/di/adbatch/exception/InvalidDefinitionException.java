package com.di.adbatch.exception;

import java.util.List;

/**
 * The campaign input is unusable as a whole. Raised before any remote call is made.
 */
public class InvalidDefinitionException extends RuntimeException {

    private final List<String> problems;

    public InvalidDefinitionException(List<String> problems) {
        super(format(problems));
        this.problems = List.copyOf(problems);
    }

    public InvalidDefinitionException(String problem, Throwable cause) {
        super(problem, cause);
        this.problems = List.of(problem);
    }

    public List<String> getProblems() {
        return problems;
    }

    private static String format(List<String> problems) {
        if (problems.size() == 1) {
            return "Invalid campaign definition: " + problems.get(0);
        }
        return "Invalid campaign definition (" + problems.size() + " problems): "
                + String.join("; ", problems);
    }
}
