package com.phillippitts.jobverdict.service.llm;

import java.util.Objects;

/**
 * Whether the LLM endpoint may be called, decided once at wiring time and injected into the
 * orchestrators. When unavailable, orchestrators skip every client call and return their degraded
 * results directly.
 *
 * @param available whether calls are allowed
 * @param reason    why calls are not allowed (empty when available)
 */
public record LlmAvailability(boolean available, String reason) {

    private static final LlmAvailability AVAILABLE = new LlmAvailability(true, "");

    public LlmAvailability {
        Objects.requireNonNull(reason, "reason must not be null");
        if (!available && reason.isBlank()) {
            throw new IllegalArgumentException("An unavailable endpoint needs a reason");
        }
    }

    public static LlmAvailability ready() {
        return AVAILABLE;
    }

    public static LlmAvailability unavailable(String reason) {
        return new LlmAvailability(false, reason);
    }
}
