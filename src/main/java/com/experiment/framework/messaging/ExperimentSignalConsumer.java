package com.experiment.framework.messaging;

import com.experiment.framework.core.ABTestingFramework;
import com.experiment.framework.domain.MlConfidenceUpdate;
import com.experiment.framework.domain.UserAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Consumes inbound signals and translates them into metric events for the experiments that declare them.
 * Errors are logged per record; a bad record never stops the listener.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "experiment.signals.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class ExperimentSignalConsumer {

    private final ABTestingFramework framework;

    @KafkaListener(
            topics = "${experiment.signals.kafka.topic.confidence-updates:ml-confidence-updates}",
            groupId = "${experiment.signals.kafka.consumer-group:experiment-framework}",
            containerFactory = "confidenceUpdateListenerContainerFactory"
    )
    public void onConfidenceUpdate(
            @Payload(required = false) MlConfidenceUpdate update,
            @Header(value = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            @Header(value = KafkaHeaders.OFFSET, required = false) Long offset) {
        try {
            if (update == null) {
                log.warn("Received null confidence update (deserialization failed). Key={}, offset={}", key, offset);
                return;
            }
            int recorded = framework.handleConfidenceUpdate(update);
            log.debug("Confidence update userId={}, confidence={}, experiments={}", update.getUserId(), update.getConfidence(), recorded);
        } catch (Exception e) {
            log.error("Error processing confidence update key={} offset={}", key, offset, e);
        }
    }

    @KafkaListener(
            topics = "${experiment.signals.kafka.topic.user-actions:user-actions}",
            groupId = "${experiment.signals.kafka.consumer-group:experiment-framework}",
            containerFactory = "userActionListenerContainerFactory"
    )
    public void onUserAction(
            @Payload(required = false) UserAction action,
            @Header(value = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            @Header(value = KafkaHeaders.OFFSET, required = false) Long offset) {
        try {
            if (action == null) {
                log.warn("Received null user action (deserialization failed). Key={}, offset={}", key, offset);
                return;
            }
            int recorded = framework.handleUserAction(action);
            log.debug("User action userId={}, action={}, experiments={}", action.getUserId(), action.getAction(), recorded);
        } catch (Exception e) {
            log.error("Error processing user action key={} offset={}", key, offset, e);
        }
    }
}
