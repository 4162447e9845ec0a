package com.planit.gamification.config;

import com.planit.gamification.event.GamificationEventPublisher;
import com.planit.gamification.service.XpLedgerService;
import com.planit.gamification.store.DocumentStore;
import com.planit.gamification.store.memory.InMemoryDocumentStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.retry.support.RetryTemplate;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.mock;

@DisplayName("GamificationConfiguration Tests")
class GamificationConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(GamificationConfiguration.class)
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .withBean(GamificationEventPublisher.class, () -> mock(GamificationEventPublisher.class));

    @Test
    @DisplayName("Should wire the in-memory store by default")
    void shouldWireDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(XpLedgerService.class);
            assertThat(context).hasSingleBean(RetryTemplate.class);
            assertThat(context.getBean(DocumentStore.class)).isInstanceOf(InMemoryDocumentStore.class);
        });
    }

    @Test
    @DisplayName("Should bind gamification properties")
    void shouldBindProperties() {
        contextRunner
                .withPropertyValues(
                        "gamification.period-zone=Europe/Berlin",
                        "gamification.leaderboard.batch-size=30",
                        "gamification.award.max-attempts=3")
                .run(context -> {
                    GamificationProperties properties = context.getBean(GamificationProperties.class);
                    assertThat(properties.getPeriodZone()).isEqualTo("Europe/Berlin");
                    assertThat(properties.getLeaderboard().getBatchSize()).isEqualTo(30);
                    assertThat(properties.getAward().getMaxAttempts()).isEqualTo(3);
                });
    }

    @Test
    @DisplayName("Should not create the in-memory store when MongoDB is selected")
    void shouldNotCreateMemoryStoreForMongo() {
        DocumentStore mongoStore = mock(DocumentStore.class);
        contextRunner
                .withPropertyValues("gamification.store.type=mongo")
                .withBean(DocumentStore.class, () -> mongoStore)
                .run(context -> {
                    assertThat(context).hasSingleBean(DocumentStore.class);
                    assertThat(context.getBean(DocumentStore.class)).isSameAs(mongoStore);
                });
    }
}
