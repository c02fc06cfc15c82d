package com.example.workflowhub.service;

import com.example.workflowhub.domain.AuditOutcome;
import com.example.workflowhub.domain.AuditRecord;
import com.example.workflowhub.repository.AuditRecordRepository;
import com.example.workflowhub.repository.WorkflowEntityRepository;
import com.example.workflowhub.security.Actor;
import com.example.workflowhub.support.HubTestConfig;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@SpringBootTest
@ActiveProfiles("test")
@Import({HubTestConfig.class, AuditFailureTest.FailingAuditConfig.class})
@DisplayName("EntityStateService when the audit store fails")
class AuditFailureTest {

    private static final Actor CURATOR = new Actor("curator", Set.of("curator"));

    @Autowired
    private EntityStateService service;

    @Autowired
    private FailingAuditLogService auditLog;

    @Autowired
    private WorkflowEntityRepository entityRepository;

    @AfterEach
    void restoreAuditStore() {
        auditLog.failOnAppliedTo(null);
    }

    @Test
    @DisplayName("a transition whose audit write fails is not applied and leaves state and version unchanged")
    void transitionRollsBack() {
        UUID id = service.create("GalleryExhibit", null, Map.of("title", "Tides"), CURATOR, null, null).entity().id();
        auditLog.failOnAppliedTo("reviewed");

        assertThrows(DataAccessResourceFailureException.class,
                () -> service.transition(id, "reviewed", CURATOR, null));

        EntitySnapshot stored = service.find(id);
        assertEquals("proposed", stored.state());
        assertEquals(0L, stored.version());
        assertThat(auditLog.findByEntity(id)).extracting(AuditRecord::getToState).containsExactly("proposed");

        auditLog.failOnAppliedTo(null);
        TransitionResult retried = service.transition(id, "reviewed", CURATOR, null);
        assertThat(retried.isApplied()).isTrue();
        assertEquals(1L, retried.entity().version());
    }

    @Test
    @DisplayName("a creation whose audit write fails stores no entity")
    void creationRollsBack() {
        long before = entityRepository.count();
        auditLog.failOnAppliedTo("proposed");

        assertThrows(DataAccessResourceFailureException.class,
                () -> service.create("GalleryExhibit", null, Map.of("title", "Ebb"), CURATOR, null, null));

        assertEquals(before, entityRepository.count());
    }

    @TestConfiguration
    static class FailingAuditConfig {

        @Bean
        @Primary
        FailingAuditLogService failingAuditLogService(AuditRecordRepository repository) {
            return new FailingAuditLogService(repository);
        }
    }

    /**
     * Audit service whose APPLIED writes into one target state fail as an unavailable store would.
     */
    static class FailingAuditLogService extends AuditLogService {

        private volatile String failingToState;

        FailingAuditLogService(AuditRecordRepository repository) {
            super(repository);
        }

        public void failOnAppliedTo(String toState) {
            this.failingToState = toState;
        }

        @Override
        public AuditRecord record(UUID entityId, String workflowType, String fromState, String toState, String actor,
                                  String triggerEvent, UUID correlationId, AuditOutcome outcome, String reason,
                                  String detail) {
            if (outcome == AuditOutcome.APPLIED && toState.equals(failingToState)) {
                throw new DataAccessResourceFailureException("audit store unavailable");
            }
            return super.record(entityId, workflowType, fromState, toState, actor, triggerEvent, correlationId,
                    outcome, reason, detail);
        }
    }
}
