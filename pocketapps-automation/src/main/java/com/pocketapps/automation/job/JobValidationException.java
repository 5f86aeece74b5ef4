package com.pocketapps.automation.job;

/**
 * Thrown when a job definition breaks a registration rule. The definition is
 * never persisted or scheduled.
 */
public class JobValidationException extends RuntimeException {

    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
