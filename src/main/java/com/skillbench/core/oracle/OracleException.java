package com.skillbench.core.oracle;

/**
 * Thrown when an oracle call fails. Always carries an {@link OracleErrorCode}.
 */
public class OracleException extends RuntimeException {

    private final OracleErrorCode code;

    public OracleException(OracleErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public OracleException(OracleErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public OracleErrorCode getCode() {
        return code;
    }

    /** "CODE: message", the form stored in failed result records. */
    public String describe() {
        return getMessage() == null ? code.name() : code.name() + ": " + getMessage();
    }
}
