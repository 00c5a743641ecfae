package com.groviate.feedbackrewards.health;

import com.groviate.feedbackrewards.service.RemoteQualityScoringService;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Состояние circuit breaker удалённой оценки качества. При OPEN - OUT_OF_SERVICE, оценку ведёт локальная эвристика.
 */
@Component
public class QualityScoringHealthIndicator implements HealthIndicator {

    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public QualityScoringHealthIndicator(CircuitBreakerRegistry circuitBreakerRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    @Override
    public Health health() {
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(RemoteQualityScoringService.CIRCUIT_BREAKER_NAME);
        CircuitBreaker.State state = cb.getState();

        Health.Builder builder = (state == CircuitBreaker.State.OPEN)
                ? Health.outOfService()
                : Health.up();

        return builder
                .withDetail("qualityScoringCircuitBreakerState", state.name())
                .withDetail("failureRate", cb.getMetrics().getFailureRate())
                .withDetail("qualityFallback", state == CircuitBreaker.State.OPEN ? "local-heuristic" : "none")
                .build();
    }
}
