package com.phillippitts.jobverdict.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection, sampling and concurrency settings for the local LLM endpoint.
 *
 * <p>Properties:
 * <ul>
 *   <li>llm.client.enabled - when false no call is ever made and results degrade (default: true)</li>
 *   <li>llm.client.base-url - server root (default: http://localhost:11434)</li>
 *   <li>llm.client.model - model tag (default: llama3.2:latest)</li>
 *   <li>llm.client.timeout-ms - per-call read timeout (default: 30000)</li>
 *   <li>llm.client.connect-timeout-ms - TCP connect timeout (default: 3000)</li>
 *   <li>llm.client.match-temperature - sampling temperature for match runs (default: 0.7)</li>
 *   <li>llm.client.adjudication-temperature - sampling temperature for location adjudication (default: 0.1)</li>
 *   <li>llm.client.top-p - nucleus sampling parameter (default: 0.9)</li>
 *   <li>llm.client.max-concurrency - in-flight calls the endpoint accepts (default: 2)</li>
 *   <li>llm.client.acquire-timeout-ms - wait for a free slot before failing the call (default: 30000)</li>
 *   <li>llm.client.probe-on-startup - ping the endpoint at startup and mark it unavailable if down (default: false)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "llm.client")
@Validated
public class LlmClientProperties {

    private boolean enabled = true;

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String model = "llama3.2:latest";

    @Positive(message = "Call timeout must be positive")
    private long timeoutMs = 30_000;

    @Positive(message = "Connect timeout must be positive")
    private long connectTimeoutMs = 3_000;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double matchTemperature = 0.7;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double adjudicationTemperature = 0.1;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double topP = 0.9;

    @Positive(message = "Max concurrency must be positive")
    private int maxConcurrency = 2;

    @Positive(message = "Acquire timeout must be positive")
    private long acquireTimeoutMs = 30_000;

    private boolean probeOnStartup = false;

    public Duration callTimeout() {
        return Duration.ofMillis(timeoutMs);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public double getMatchTemperature() {
        return matchTemperature;
    }

    public void setMatchTemperature(double matchTemperature) {
        this.matchTemperature = matchTemperature;
    }

    public double getAdjudicationTemperature() {
        return adjudicationTemperature;
    }

    public void setAdjudicationTemperature(double adjudicationTemperature) {
        this.adjudicationTemperature = adjudicationTemperature;
    }

    public double getTopP() {
        return topP;
    }

    public void setTopP(double topP) {
        this.topP = topP;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public long getAcquireTimeoutMs() {
        return acquireTimeoutMs;
    }

    public void setAcquireTimeoutMs(long acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }

    public boolean isProbeOnStartup() {
        return probeOnStartup;
    }

    public void setProbeOnStartup(boolean probeOnStartup) {
        this.probeOnStartup = probeOnStartup;
    }
}
