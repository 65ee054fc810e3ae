package com.phillippitts.jobverdict.domain;

/**
 * Errors surfaced to callers as explicit result values rather than exceptions.
 */
public enum ErrorKind {
    /** No evaluation run yielded a match level after all retries. */
    EXTRACTION_FAILURE
}
