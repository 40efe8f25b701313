package com.experiment.framework.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.experiment.framework.domain.MlConfidenceUpdate;
import com.experiment.framework.domain.UserAction;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.util.backoff.FixedBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka consumers for the inbound signal streams: ML confidence updates and user actions (JSON).
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "experiment.signals.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class SignalKafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${experiment.signals.kafka.consumer-group:experiment-framework}")
    private String consumerGroup;

    @Bean
    public ConsumerFactory<String, MlConfidenceUpdate> confidenceUpdateConsumerFactory() {
        return consumerFactory(MlConfidenceUpdate.class);
    }

    @Bean
    public ConsumerFactory<String, UserAction> userActionConsumerFactory() {
        return consumerFactory(UserAction.class);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, MlConfidenceUpdate> confidenceUpdateListenerContainerFactory(
            ConsumerFactory<String, MlConfidenceUpdate> confidenceUpdateConsumerFactory) {
        return containerFactory(confidenceUpdateConsumerFactory);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, UserAction> userActionListenerContainerFactory(
            ConsumerFactory<String, UserAction> userActionConsumerFactory) {
        return containerFactory(userActionConsumerFactory);
    }

    private <T> ConsumerFactory<String, T> consumerFactory(Class<T> type) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroup);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        // @Jacksonized payloads deserialize through their Lombok builders
        JsonDeserializer<T> deserializer = new JsonDeserializer<>(type, signalObjectMapper());
        deserializer.setUseTypeHeaders(false);
        deserializer.addTrustedPackages("com.experiment.framework");
        return new DefaultKafkaConsumerFactory<>(props, new StringDeserializer(), new ErrorHandlingDeserializer<>(deserializer));
    }

    private <T> ConcurrentKafkaListenerContainerFactory<String, T> containerFactory(ConsumerFactory<String, T> consumerFactory) {
        ConcurrentKafkaListenerContainerFactory<String, T> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.RECORD);
        factory.setCommonErrorHandler(new DefaultErrorHandler(new FixedBackOff(0L, 0L)) {
            @Override
            public void handleOtherException(Exception thrownException, Consumer<?, ?> consumer,
                                             MessageListenerContainer container, boolean batchListener) {
                Throwable cause = thrownException.getCause();
                if (cause != null && cause.getClass().getSimpleName().contains("Deserialization")) {
                    log.error("Signal deserialization error, record skipped: {}", cause.getMessage(), thrownException);
                } else {
                    log.error("Signal listener error", thrownException);
                }
                super.handleOtherException(thrownException, consumer, container, batchListener);
            }
        });
        return factory;
    }

    private static ObjectMapper signalObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
