package com.phillippitts.jobverdict.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link TransportException} with contextual details.
 *
 * <pre>
 * throw TransportExceptionBuilder.create("LLM endpoint returned error status")
 *         .client("ollama-match")
 *         .httpStatus(502)
 *         .durationMs(1200)
 *         .metadata("endpoint", url)
 *         .build();
 * </pre>
 *
 * <p>Message format: {@code {message} (httpStatus={code}, durationMs={ms}, {key}={value}, ...) (client: {name})}
 */
public final class TransportExceptionBuilder {

    private final String message;
    private String clientName;
    private Throwable cause;
    private Integer httpStatus;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TransportExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * @param message base error message (must not be null or empty)
     */
    public static TransportExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TransportExceptionBuilder(message);
    }

    public TransportExceptionBuilder client(String clientName) {
        this.clientName = clientName;
        return this;
    }

    public TransportExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TransportExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        return this;
    }

    public TransportExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value pair to the message. Null keys or values are ignored.
     * Never pass prompt or response text here.
     */
    public TransportExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public TransportException build() {
        String detailedMessage = buildDetailedMessage();
        String client = clientName != null ? clientName : "unknown";

        if (cause != null) {
            return new TransportException(detailedMessage, client, cause);
        }
        return new TransportException(detailedMessage, client);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = httpStatus != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (httpStatus != null) {
            sb.append("httpStatus=").append(httpStatus);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        return sb.append(")").toString();
    }
}
