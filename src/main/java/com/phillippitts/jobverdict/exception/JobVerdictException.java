package com.phillippitts.jobverdict.exception;

/**
 * Base exception for all job-verdict application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class JobVerdictException extends RuntimeException {

    public JobVerdictException(String message) {
        super(message);
    }

    public JobVerdictException(String message, Throwable cause) {
        super(message, cause);
    }

    public JobVerdictException(Throwable cause) {
        super(cause);
    }
}
