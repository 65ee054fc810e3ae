package com.phillippitts.jobverdict.service.health;

import com.phillippitts.jobverdict.config.properties.LlmClientProperties;
import com.phillippitts.jobverdict.service.llm.LlmAvailability;
import com.phillippitts.jobverdict.service.llm.LlmEvaluationClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the LLM endpoint.
 *
 * <ul>
 *   <li>DOWN: endpoint disabled or marked unavailable at startup</li>
 *   <li>UP: endpoint answers a live ping</li>
 *   <li>DEGRADED: endpoint configured but not answering; evaluations return degraded results</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class LlmEndpointHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED");

    private final LlmAvailability availability;
    private final LlmEvaluationClient client;
    private final LlmClientProperties props;

    public LlmEndpointHealthIndicator(LlmAvailability availability,
                                      @Qualifier("matchLlmClient") LlmEvaluationClient client,
                                      LlmClientProperties props) {
        this.availability = availability;
        this.client = client;
        this.props = props;
    }

    @Override
    public Health health() {
        if (!availability.available()) {
            return Health.down()
                    .withDetail("reason", availability.reason())
                    .withDetail("baseUrl", props.getBaseUrl())
                    .build();
        }
        boolean reachable = client.ping();
        Health.Builder builder = reachable ? Health.up() : Health.status(DEGRADED);
        return builder
                .withDetail("baseUrl", props.getBaseUrl())
                .withDetail("model", props.getModel())
                .withDetail("reachable", reachable)
                .build();
    }
}
