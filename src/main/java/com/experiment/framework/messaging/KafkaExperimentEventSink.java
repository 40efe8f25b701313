package com.experiment.framework.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Forwards lifecycle events to a Kafka topic keyed by experiment id, so all events of one experiment
 * land on the same partition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "experiment.events.kafka.enabled", havingValue = "true")
public class KafkaExperimentEventSink implements ExperimentEventSink {

    private final KafkaTemplate<String, ExperimentEvent> experimentEventKafkaTemplate;

    @Value("${experiment.events.kafka.topic:experiment-events}")
    private String topic;

    @Override
    public String getSinkName() {
        return "kafka";
    }

    @Override
    public void publish(ExperimentEvent event) {
        CompletableFuture<SendResult<String, ExperimentEvent>> future =
                experimentEventKafkaTemplate.send(topic, event.getExperimentId(), event);
        future.whenComplete((result, ex) -> {
            if (ex != null) log.error("Failed to send experiment event {} type={}", event.getEventId(), event.getType(), ex);
            else log.debug("Sent experiment event {} partition={}", event.getEventId(), result != null ? result.getRecordMetadata().partition() : null);
        });
    }
}
