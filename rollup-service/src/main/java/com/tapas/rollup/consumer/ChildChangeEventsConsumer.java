package com.tapas.rollup.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tapas.rollup.config.RollupProperties;
import com.tapas.rollup.domain.ChildChangeBatch;
import com.tapas.rollup.dto.ChildChangeEventPayload;
import com.tapas.rollup.service.RollupUpdateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ChildChangeEventsConsumer {

    private static final Logger log =
            LoggerFactory.getLogger(ChildChangeEventsConsumer.class);

    private final ObjectMapper objectMapper;
    private final RollupUpdateService updateService;
    private final RollupProperties properties;

    public ChildChangeEventsConsumer(ObjectMapper objectMapper,
                                     RollupUpdateService updateService,
                                     RollupProperties properties) {
        this.objectMapper = objectMapper;
        this.updateService = updateService;
        this.properties = properties;
    }

    @KafkaListener(
            topics = "${rollup.topic:child-record-changes}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(List<String> payloads) throws JsonProcessingException {
        try {
            var batches = new ArrayList<ChildChangeBatch>();
            for (String payload : payloads) {
                batches.add(objectMapper.readValue(payload, ChildChangeEventPayload.class).toBatch());
            }

            updateService.applyChanges(batches, properties.isPersistResults());

        } catch (Exception e) {
            log.error("Failed to process child change payloads", e);
            throw e; // Kafka retry
        }
    }
}
