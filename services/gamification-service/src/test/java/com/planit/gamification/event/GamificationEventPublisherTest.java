package com.planit.gamification.event;

import com.planit.gamification.config.GamificationProperties;
import com.planit.gamification.domain.Milestone;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("GamificationEventPublisher Tests")
class GamificationEventPublisherTest {

    @Mock
    private ApplicationEventPublisher springEventPublisher;

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private SimpleMeterRegistry meterRegistry;
    private GamificationEventPublisher publisher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        publisher = new GamificationEventPublisher(springEventPublisher, kafkaTemplate, new GamificationProperties(), meterRegistry);
    }

    @Test
    @DisplayName("Should publish in-process and to the signal's topic keyed by user")
    void shouldPublishToTopic() {
        // Given
        LevelUpEvent event = LevelUpEvent.builder()
                .eventId("sig-1")
                .userId("alice")
                .timestamp(Instant.parse("2025-03-15T12:00:00Z"))
                .newLevel(2)
                .build();
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.completedFuture(null));

        // When
        publisher.publish(event);

        // Then
        verify(springEventPublisher).publishEvent(event);
        verify(kafkaTemplate).send("gamification.level-up", "alice", event);
        assertThat(meterRegistry.counter("gamification.signal.published", "type", "LEVEL_UP").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should route each signal type to its own topic")
    void shouldRouteTopics() {
        assertThat(publisher.topicFor(XpGainedEvent.builder().amount(50).build())).isEqualTo("gamification.xp-gained");
        assertThat(publisher.topicFor(MilestoneReachedEvent.builder()
                .milestone(new Milestone(Milestone.Type.LEVEL, 5)).build())).isEqualTo("gamification.milestone");
        assertThat(publisher.topicFor(AwardFailedEvent.builder().errorCode("AWARD_FAILED").build()))
                .isEqualTo("gamification.award-failed");
    }

    @Test
    @DisplayName("Should swallow Kafka failures and count them")
    void shouldNotFailOnKafkaError() {
        XpGainedEvent event = XpGainedEvent.builder().eventId("sig-2").userId("alice").amount(50).build();
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThatCode(() -> publisher.publish(event)).doesNotThrowAnyException();

        verify(springEventPublisher).publishEvent(event);
        assertThat(meterRegistry.counter("gamification.signal.failed", "type", "XP_GAINED").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should still publish to Kafka when an in-process listener fails")
    void shouldIsolateListenerFailures() {
        XpGainedEvent event = XpGainedEvent.builder().eventId("sig-3").userId("alice").amount(50).build();
        doThrow(new IllegalStateException("listener bug")).when(springEventPublisher).publishEvent(any(Object.class));

        publisher.publish(event);

        verify(kafkaTemplate).send("gamification.xp-gained", "alice", event);
    }
}
