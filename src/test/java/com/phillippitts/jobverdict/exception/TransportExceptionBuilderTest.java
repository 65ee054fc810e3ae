package com.phillippitts.jobverdict.exception;

import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransportExceptionBuilderTest {

    @Test
    void buildsMessageWithAllDetails() {
        TransportException ex = TransportExceptionBuilder.create("LLM endpoint returned error status")
                .client("match")
                .httpStatus(502)
                .durationMs(1200)
                .metadata("endpoint", "http://localhost:11434/api/generate")
                .build();

        assertThat(ex.getMessage()).isEqualTo("LLM endpoint returned error status "
                + "(httpStatus=502, durationMs=1200, endpoint=http://localhost:11434/api/generate) (client: match)");
        assertThat(ex.getClientName()).isEqualTo("match");
    }

    @Test
    void plainMessageWithoutDetails() {
        TransportException ex = TransportExceptionBuilder.create("LLM call failed").build();

        assertThat(ex.getMessage()).isEqualTo("LLM call failed (client: unknown)");
    }

    @Test
    void keepsCauseAndIgnoresNullMetadata() {
        SocketTimeoutException cause = new SocketTimeoutException("Read timed out");
        TransportException ex = TransportExceptionBuilder.create("LLM endpoint timeout")
                .client("adjudication")
                .metadata("endpoint", null)
                .metadata(null, "x")
                .cause(cause)
                .build();

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getMessage()).isEqualTo("LLM endpoint timeout (client: adjudication)");
    }

    @Test
    void rejectsEmptyMessage() {
        assertThatThrownBy(() -> TransportExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
