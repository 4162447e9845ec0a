package com.planit.gamification.event;

import com.planit.gamification.config.GamificationProperties;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes ledger signals in-process (Spring events) and to Kafka for the notification
 * collaborators.
 *
 * <p>Signals are best effort: a Kafka failure is logged and counted but never fails the
 * award that produced the signal, which is already committed by then.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GamificationEventPublisher {

    private final ApplicationEventPublisher springEventPublisher;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final GamificationProperties properties;
    private final MeterRegistry meterRegistry;

    public void publish(GamificationEvent event) {
        try {
            springEventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("In-process listener failed for {}: userId={}", event.getEventType(), event.getUserId(), e);
        }
        publishExternal(event);
    }

    private void publishExternal(GamificationEvent event) {
        String topic = topicFor(event);
        try {
            CompletableFuture<?> send = kafkaTemplate.send(topic, event.getUserId(), event);
            if (send != null) {
                send.whenComplete((result, ex) -> {
                    if (ex != null) {
                        recordFailure(event, topic, ex);
                    } else {
                        meterRegistry.counter("gamification.signal.published", "type", event.getEventType()).increment();
                    }
                });
            }
        } catch (RuntimeException e) {
            recordFailure(event, topic, e);
        }
    }

    private void recordFailure(GamificationEvent event, String topic, Throwable error) {
        log.warn("Failed to publish {} to {}: userId={}, eventId={}, error={}",
                event.getEventType(), topic, event.getUserId(), event.getEventId(), error.getMessage());
        meterRegistry.counter("gamification.signal.failed", "type", event.getEventType()).increment();
    }

    String topicFor(GamificationEvent event) {
        GamificationProperties.Topics topics = properties.getTopics();
        if (event instanceof LevelUpEvent) {
            return topics.getLevelUp();
        }
        if (event instanceof MilestoneReachedEvent) {
            return topics.getMilestone();
        }
        if (event instanceof AwardFailedEvent) {
            return topics.getAwardFailed();
        }
        return topics.getXpGained();
    }
}
