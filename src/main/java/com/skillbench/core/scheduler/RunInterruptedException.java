package com.skillbench.core.scheduler;

/**
 * Thrown to a caller blocked in {@link EvaluationRunner#runToCompletion} when the
 * run it waits for is stopped instead of completing.
 */
public class RunInterruptedException extends RuntimeException {

    public RunInterruptedException(String message) {
        super(message);
    }

    public RunInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
