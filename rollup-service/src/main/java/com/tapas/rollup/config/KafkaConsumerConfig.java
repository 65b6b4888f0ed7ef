package com.tapas.rollup.config;

import com.tapas.rollup.service.RollupConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

/**
 * Batch listener setup for child record change events. Failed batches are retried a
 * bounded number of times before the error handler gives up and logs them; rollup
 * configuration errors are not retried.
 */
@Configuration
public class KafkaConsumerConfig {

    private static final Logger log = LoggerFactory.getLogger(KafkaConsumerConfig.class);

    @Value("${rollup.consumer.retry-interval-ms:1000}")
    private long retryIntervalMs;

    @Value("${rollup.consumer.max-retries:3}")
    private long maxRetries;

    @Bean
    public ConsumerFactory<String, String> consumerFactory(KafkaProperties kafkaProperties) {
        return new DefaultKafkaConsumerFactory<>(kafkaProperties.buildConsumerProperties(null));
    }

    @Bean
    public DefaultErrorHandler rollupErrorHandler() {
        log.info("Rollup consumer retries: {} every {} ms", maxRetries, retryIntervalMs);
        var handler = new DefaultErrorHandler(new FixedBackOff(retryIntervalMs, maxRetries));
        // misconfigured definitions fail the same way on every attempt
        handler.addNotRetryableExceptions(RollupConfigurationException.class);
        return handler;
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory(
            ConsumerFactory<String, String> consumerFactory,
            DefaultErrorHandler rollupErrorHandler) {

        ConcurrentKafkaListenerContainerFactory<String, String> factory = new ConcurrentKafkaListenerContainerFactory<>();

        factory.setConsumerFactory(consumerFactory);
        factory.setConcurrency(1); // one batch at a time keeps parent updates ordered
        factory.setBatchListener(true);
        factory.setCommonErrorHandler(rollupErrorHandler);

        return factory;
    }
}
