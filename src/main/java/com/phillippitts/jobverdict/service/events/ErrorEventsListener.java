package com.phillippitts.jobverdict.service.events;

import com.phillippitts.jobverdict.service.llm.LlmCallFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for LLM failure events. Privacy-safe and throttled to avoid log spam when the
 * endpoint is down and every run fails the same way.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onLlmCallFailure(LlmCallFailureEvent e) {
        String key = "llm-" + e.client() + '-' + e.reason();
        if (shouldLog(key)) {
            if ("concurrency-limit".equals(e.reason())) {
                LOG.warn("LLM endpoint saturated: client={}. Lower evaluation parallelism or raise "
                        + "llm.client.max-concurrency.", e.client());
            } else {
                LOG.warn("LLM call failed: client={}, reason={}, message={}. Check that the endpoint at "
                        + "llm.client.base-url is running.", e.client(), e.reason(), e.message());
            }
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
