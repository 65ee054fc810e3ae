package com.phillippitts.jobverdict.service.llm;

import com.phillippitts.jobverdict.exception.TransportException;
import com.phillippitts.jobverdict.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Semaphore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyGuardTest {

    @Test
    void acquireAndReleaseRestorePermits() {
        ConcurrencyGuard guard = new ConcurrencyGuard(new Semaphore(2), 100, "llm", null);

        guard.acquire();
        assertThat(guard.availablePermits()).isEqualTo(1);
        guard.release();
        assertThat(guard.availablePermits()).isEqualTo(2);
    }

    @Test
    void exhaustedPermitsFailAfterTimeoutAndPublishEvent() {
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        ConcurrencyGuard guard = new ConcurrencyGuard(new Semaphore(1), 50, "llm", publisher);
        guard.acquire();

        assertThatThrownBy(guard::acquire)
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("concurrency limit reached after 50ms");

        assertThat(publisher.failureEvents()).singleElement().satisfies(e -> {
            assertThat(e.client()).isEqualTo("llm");
            assertThat(e.reason()).isEqualTo("concurrency-limit");
            assertThat(e.context()).containsEntry("timeoutMs", "50");
        });
    }

    @Test
    void interruptedWaitFailsAndKeepsInterruptFlag() {
        ConcurrencyGuard guard = new ConcurrencyGuard(new Semaphore(0), 1_000, "llm", null);
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(guard::acquire)
                    .isInstanceOf(TransportException.class)
                    .hasMessageContaining("interrupted");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
