package com.phillippitts.jobverdict.service.llm;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a call to the LLM endpoint fails (timeout, connection refused, error status,
 * malformed body, concurrency limit).
 *
 * <p>PII note: never put prompt or response text in the context. Restrict to technical diagnostics.
 */
public record LlmCallFailureEvent(
        String client,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public LlmCallFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public String reason() {
        return context.getOrDefault("reason", "unknown");
    }
}
