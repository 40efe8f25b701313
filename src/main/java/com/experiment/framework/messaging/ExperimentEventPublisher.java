package com.experiment.framework.messaging;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Fans lifecycle events out to every registered sink. Each sink sits behind its own circuit breaker;
 * a failing or open sink is logged and skipped, and publishing never throws.
 */
@Slf4j
@Component
public class ExperimentEventPublisher {

    private final List<ExperimentEventSink> sinks;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Clock clock;

    public ExperimentEventPublisher(List<ExperimentEventSink> sinks, CircuitBreakerRegistry circuitBreakerRegistry, Clock clock) {
        this.sinks = List.copyOf(sinks);
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.clock = clock;
    }

    public ExperimentEvent publish(ExperimentEventType type, String experimentId, Object payload) {
        ExperimentEvent event = ExperimentEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .experimentId(experimentId)
                .payload(payload)
                .timestamp(clock.instant())
                .build();
        for (ExperimentEventSink sink : sinks) {
            CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker("experiment-events-" + sink.getSinkName());
            try {
                circuitBreaker.executeRunnable(() -> sink.publish(event));
            } catch (CallNotPermittedException e) {
                log.debug("Sink {} circuit open, dropped event type={}, experimentId={}", sink.getSinkName(), type, experimentId);
            } catch (RuntimeException e) {
                log.warn("Sink {} failed for event type={}, experimentId={}: {}", sink.getSinkName(), type, experimentId, e.getMessage());
            }
        }
        return event;
    }
}
