package com.phillippitts.jobverdict.exception;

/**
 * Thrown when a call to the LLM endpoint fails: connection refused, timeout, non-2xx status,
 * or a body without a response field. Orchestrators recover from it locally.
 */
public class TransportException extends JobVerdictException {

    private final String clientName;

    public TransportException(String message) {
        super(message);
        this.clientName = "unknown";
    }

    public TransportException(String message, String clientName) {
        super(message + " (client: " + clientName + ")");
        this.clientName = clientName;
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.clientName = "unknown";
    }

    public TransportException(String message, String clientName, Throwable cause) {
        super(message + " (client: " + clientName + ")", cause);
        this.clientName = clientName;
    }

    public String getClientName() {
        return clientName;
    }
}
