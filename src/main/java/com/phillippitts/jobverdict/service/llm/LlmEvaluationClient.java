package com.phillippitts.jobverdict.service.llm;

import com.phillippitts.jobverdict.exception.TransportException;

import java.time.Duration;

/**
 * Synchronous request/response access to a local LLM inference endpoint.
 *
 * <p>The client has no semantic contract on content: it takes an opaque prompt and returns raw text.
 * Implementations must be thread-safe; the consensus evaluator may call them from several worker
 * threads at once.
 */
public interface LlmEvaluationClient {

    /**
     * Sends a prompt and blocks until the response text arrives or the timeout expires.
     *
     * @param prompt  fully rendered prompt
     * @param timeout per-call bound; a call exceeding it fails with {@link TransportException}
     * @return raw response text (may be empty)
     * @throws TransportException if the endpoint is unreachable, times out, or answers malformed
     */
    String evaluate(String prompt, Duration timeout);

    /**
     * Cheap reachability check used by health reporting. Never throws.
     */
    boolean ping();

    /**
     * Name used in logs, metrics and events.
     */
    String name();
}
