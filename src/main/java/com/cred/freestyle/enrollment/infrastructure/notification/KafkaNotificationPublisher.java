package com.cred.freestyle.enrollment.infrastructure.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for subject notifications.
 * A downstream notification service renders and sends the messages (email, push).
 *
 * Topic partitioning strategy:
 * - Key: subject_id (all notifications of one subject stay ordered on one partition)
 *
 * @author Enrollment Team
 */
@Service
public class KafkaNotificationPublisher {

    private static final Logger logger = LoggerFactory.getLogger(KafkaNotificationPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;

    public KafkaNotificationPublisher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            @Value("${enrollment.notifications.topic:enrollment-notifications}") String topic
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
    }

    /**
     * Publish a notification event.
     * The returned future fails if the event cannot be serialized or the broker rejects it.
     *
     * @param event Notification event
     * @return Send outcome
     */
    public CompletableFuture<SendResult<String, String>> publish(EnrollmentNotificationEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {} notification for subject {}",
                    event.getKind(), event.getSubjectId(), e);
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                topic,
                event.getSubjectId(),
                payload
        );

        return future.whenComplete((result, ex) -> {
            if (ex == null) {
                logger.info("Published {} notification for subject {}, offering {}, partition: {}",
                        event.getKind(), event.getSubjectId(), event.getOfferingId(),
                        result.getRecordMetadata().partition());
            } else {
                logger.error("Failed to publish {} notification for subject {}, offering {}",
                        event.getKind(), event.getSubjectId(), event.getOfferingId(), ex);
            }
        });
    }

    public String getTopic() {
        return topic;
    }
}
