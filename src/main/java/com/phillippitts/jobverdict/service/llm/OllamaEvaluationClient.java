package com.phillippitts.jobverdict.service.llm;

import com.phillippitts.jobverdict.exception.TransportException;
import com.phillippitts.jobverdict.exception.TransportExceptionBuilder;
import com.phillippitts.jobverdict.service.metrics.VerdictMetricsPublisher;
import com.phillippitts.jobverdict.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link LlmEvaluationClient} for an Ollama server's non-streaming {@code /api/generate} endpoint.
 *
 * <p>Request body: {@code {"model", "prompt", "stream": false, "options": {"temperature", "top_p"}}}.
 * The generated text is read from the {@code response} field of the JSON reply.
 *
 * <p><b>Timeouts:</b> the per-call timeout becomes the HTTP read timeout. One {@link RestTemplate} is
 * built and cached per distinct timeout value.
 *
 * <p><b>Concurrency:</b> every call holds a permit of the shared {@link ConcurrencyGuard} for its
 * whole duration.
 *
 * <p><b>Failures:</b> any transport problem is rethrown as {@link TransportException}, counted in
 * metrics, and published as an {@link LlmCallFailureEvent}.
 */
public class OllamaEvaluationClient implements LlmEvaluationClient {

    private static final Logger LOG = LogManager.getLogger(OllamaEvaluationClient.class);

    private static final String GENERATE_PATH = "/api/generate";
    private static final String TAGS_PATH = "/api/tags";
    private static final Duration PING_TIMEOUT = Duration.ofSeconds(2);

    private final String name;
    private final String baseUrl;
    private final String model;
    private final double temperature;
    private final double topP;
    private final Duration connectTimeout;
    private final RestTemplateBuilder builder;
    private final ConcurrencyGuard guard;
    private final ApplicationEventPublisher publisher;
    private final VerdictMetricsPublisher metrics;
    private final Map<Duration, RestTemplate> templates = new ConcurrentHashMap<>();

    /**
     * @param name        client name for logs, metrics and events
     * @param baseUrl     server root, e.g. {@code http://localhost:11434}
     * @param model       model tag, e.g. {@code llama3.2:latest}
     * @param temperature sampling temperature sent with every request
     * @param topP        nucleus sampling parameter sent with every request
     * @param connectTimeout TCP connect timeout
     * @param builder     Spring-configured builder for HTTP clients
     * @param guard       shared endpoint concurrency cap
     * @param publisher   failure event publisher (nullable)
     * @param metrics     metrics facade (nullable, defaults to no-op)
     */
    public OllamaEvaluationClient(String name,
                                  String baseUrl,
                                  String model,
                                  double temperature,
                                  double topP,
                                  Duration connectTimeout,
                                  RestTemplateBuilder builder,
                                  ConcurrencyGuard guard,
                                  ApplicationEventPublisher publisher,
                                  VerdictMetricsPublisher metrics) {
        this.name = Objects.requireNonNull(name, "name");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.model = Objects.requireNonNull(model, "model");
        this.temperature = temperature;
        this.topP = topP;
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.publisher = publisher;
        this.metrics = metrics == null ? VerdictMetricsPublisher.NOOP : metrics;
    }

    @Override
    public String evaluate(String prompt, Duration timeout) {
        Objects.requireNonNull(prompt, "prompt");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }

        guard.acquire();
        long t0 = System.nanoTime();
        try {
            ResponseEntity<String> response = restTemplateFor(timeout)
                    .postForEntity(baseUrl + GENERATE_PATH, jsonEntity(requestBody(prompt)), String.class);
            String text = parseResponse(response.getBody(), t0);
            metrics.recordLlmCall(name, t0);
            LOG.debug("{} call completed in {} ms ({} chars)", name, TimeUtils.elapsedMillis(t0), text.length());
            return text;
        } catch (RestClientResponseException e) {
            throw fail("LLM endpoint returned error status", "http_error", t0, e, e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            String reason = e.getCause() instanceof SocketTimeoutException ? "timeout" : "unreachable";
            throw fail("LLM endpoint " + reason, reason, t0, e, null);
        } catch (RestClientException e) {
            throw fail("LLM call failed", "client_error", t0, e, null);
        } finally {
            guard.release();
        }
    }

    @Override
    public boolean ping() {
        try {
            ResponseEntity<String> response = restTemplateFor(PING_TIMEOUT)
                    .getForEntity(baseUrl + TAGS_PATH, String.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            LOG.debug("{} ping failed: {}", name, e.getMessage());
            return false;
        }
    }

    @Override
    public String name() {
        return name;
    }

    String requestBody(String prompt) {
        JSONObject options = new JSONObject()
                .put("temperature", temperature)
                .put("top_p", topP);
        return new JSONObject()
                .put("model", model)
                .put("prompt", prompt)
                .put("stream", false)
                .put("options", options)
                .toString();
    }

    private String parseResponse(String body, long t0) {
        if (body == null || body.isBlank()) {
            throw fail("LLM endpoint returned an empty body", "malformed", t0, null, null);
        }
        try {
            JSONObject json = new JSONObject(body);
            if (!json.has("response")) {
                throw fail("LLM endpoint reply has no response field", "malformed", t0, null, null);
            }
            return json.optString("response", "");
        } catch (JSONException e) {
            throw fail("LLM endpoint returned malformed JSON", "malformed", t0, e, null);
        }
    }

    private TransportException fail(String message, String reason, long t0, Throwable cause, Integer status) {
        long ms = TimeUtils.elapsedMillis(t0);
        metrics.recordLlmFailure(name, reason);
        LOG.warn("{} call failed after {} ms: {} ({})", name, ms, message, reason);

        if (publisher != null) {
            Map<String, String> context = new HashMap<>();
            context.put("reason", reason);
            context.put("durationMs", String.valueOf(ms));
            if (status != null) {
                context.put("httpStatus", String.valueOf(status));
            }
            publisher.publishEvent(new LlmCallFailureEvent(name, Instant.now(), message, cause, context));
        }

        TransportExceptionBuilder b = TransportExceptionBuilder.create(message)
                .client(name)
                .durationMs(ms)
                .metadata("endpoint", baseUrl + GENERATE_PATH);
        if (status != null) {
            b.httpStatus(status);
        }
        if (cause != null) {
            b.cause(cause);
        }
        return b.build();
    }

    private RestTemplate restTemplateFor(Duration readTimeout) {
        return templates.computeIfAbsent(readTimeout, t -> builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(t)
                .build());
    }

    private static HttpEntity<String> jsonEntity(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
