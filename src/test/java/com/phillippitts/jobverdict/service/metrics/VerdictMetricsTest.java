package com.phillippitts.jobverdict.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class VerdictMetricsTest {

    private MeterRegistry registry;
    private VerdictMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new VerdictMetrics(registry);
    }

    @Test
    void shouldRecordLatencyPerClient() {
        metrics.recordLlmLatency("match", TimeUnit.MILLISECONDS.toNanos(100));
        metrics.recordLlmLatency("match", TimeUnit.MILLISECONDS.toNanos(150));

        Timer timer = registry.find("jobverdict.llm.latency").tag("client", "match").timer();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250);
    }

    @Test
    void shouldTagFailuresByReason() {
        metrics.incrementLlmFailure("adjudication", "timeout");
        metrics.incrementLlmFailure("adjudication", "timeout");
        metrics.incrementLlmFailure("adjudication", "http_error");

        Counter timeouts = registry.find("jobverdict.llm.failure")
                .tag("client", "adjudication").tag("reason", "timeout").counter();

        assertThat(timeouts).isNotNull();
        assertThat(timeouts.count()).isEqualTo(2.0);
    }

    @Test
    void shouldCountVerdictsByLevelAndAdjustment() {
        metrics.recordMatchVerdict("LOW", "DOMAIN_GAP_TO_LOW");

        Counter counter = registry.find("jobverdict.match.verdict")
                .tag("level", "LOW").tag("adjustment", "DOMAIN_GAP_TO_LOW").counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountLocationOutcomes() {
        metrics.recordLocationValidation("GAZETTEER", true);
        metrics.incrementLocationOverride("ungrounded");

        assertThat(registry.find("jobverdict.location.validation")
                .tag("method", "GAZETTEER").tag("conflict", "true").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("jobverdict.location.override")
                .tag("override", "ungrounded").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountRetriesAndFailedRuns() {
        metrics.incrementExtractionRetry();
        metrics.incrementFailedRun();

        assertThat(registry.find("jobverdict.match.retry").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("jobverdict.match.run.failed").counter().count()).isEqualTo(1.0);
    }
}
