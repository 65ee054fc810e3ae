package com.phillippitts.jobverdict.service.events;

import com.phillippitts.jobverdict.service.llm.LlmCallFailureEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        ErrorEventsListener l = new ErrorEventsListener();
        assertThat(l.shouldLog("llm-match-timeout")).isTrue();
        assertThat(l.shouldLog("llm-match-timeout")).isFalse();
        // other keys are throttled independently
        assertThat(l.shouldLog("llm-adjudication-timeout")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        ErrorEventsListener l = new ErrorEventsListener();
        l.onLlmCallFailure(new LlmCallFailureEvent("match", Instant.now(), "LLM endpoint timeout", null,
                Map.of("reason", "timeout")));
        l.onLlmCallFailure(new LlmCallFailureEvent("llm", null, "concurrency limit reached", null,
                Map.of("reason", "concurrency-limit")));
        l.onLlmCallFailure(new LlmCallFailureEvent("match", Instant.now(), "no context", null, null));

        assertThat(l.shouldLog("llm-match-timeout")).isFalse();
        assertThat(l.shouldLog("llm-match-unknown")).isFalse();
    }
}
