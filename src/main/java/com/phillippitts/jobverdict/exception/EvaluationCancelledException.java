package com.phillippitts.jobverdict.exception;

/**
 * Thrown when the thread driving an evaluation is interrupted. In-flight runs are abandoned and no
 * partial verdict is returned.
 */
public class EvaluationCancelledException extends JobVerdictException {

    public EvaluationCancelledException(String message) {
        super(message);
    }

    public EvaluationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
