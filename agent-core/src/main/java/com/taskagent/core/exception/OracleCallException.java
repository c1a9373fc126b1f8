package com.taskagent.core.exception;

/**
 * Network or parse failure while asking the oracle for the next action.
 * The engine turns it into a non-terminal action and retries on the next iteration.
 */
public class OracleCallException extends AgentException {

    public static final String ERROR_CODE = "ORACLE_CALL_FAILED";

    public OracleCallException(String message) {
        super(ERROR_CODE, message);
    }

    public OracleCallException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
