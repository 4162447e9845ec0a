package com.planit.gamification;

import com.planit.gamification.service.ProjectionReconciler;
import com.planit.gamification.service.XpLedgerService;
import com.planit.gamification.store.DocumentStore;
import com.planit.gamification.store.memory.InMemoryDocumentStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.config.FixedDelayTask;
import org.springframework.scheduling.config.ScheduledTask;
import org.springframework.scheduling.config.ScheduledTaskHolder;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@DisplayName("GamificationServiceApplication Tests")
class GamificationServiceApplicationTest {

    @Autowired
    private XpLedgerService xpLedgerService;

    @Autowired
    private ProjectionReconciler projectionReconciler;

    @Autowired
    private DocumentStore documentStore;

    @Autowired
    private ScheduledTaskHolder scheduledTaskHolder;

    @Test
    @DisplayName("Should start with the packaged configuration")
    void shouldStartWithPackagedConfiguration() {
        assertThat(xpLedgerService).isNotNull();
        assertThat(projectionReconciler).isNotNull();
        assertThat(documentStore).isInstanceOf(InMemoryDocumentStore.class);
    }

    @Test
    @DisplayName("Should schedule reconciliation and idle-session sweeps at the configured delays")
    void shouldScheduleBackgroundPasses() {
        assertThat(scheduledTaskHolder.getScheduledTasks())
                .extracting(ScheduledTask::getTask)
                .filteredOn(FixedDelayTask.class::isInstance)
                .extracting(task -> ((FixedDelayTask) task).getIntervalDuration())
                .contains(Duration.ofSeconds(30), Duration.ofMinutes(1));
    }
}
