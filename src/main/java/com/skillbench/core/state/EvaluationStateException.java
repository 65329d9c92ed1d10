package com.skillbench.core.state;

/**
 * Thrown when an operation is invoked in a state that does not allow it
 * (for example starting a run while one is already active).
 */
public class EvaluationStateException extends RuntimeException {

    private final ErrorCode code;

    public EvaluationStateException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public static EvaluationStateException notFound(String what) {
        return new EvaluationStateException(ErrorCode.NOT_FOUND, what + " not found");
    }
}
