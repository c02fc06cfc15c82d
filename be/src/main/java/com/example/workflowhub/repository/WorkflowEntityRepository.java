package com.example.workflowhub.repository;

import com.example.workflowhub.domain.WorkflowEntity;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowEntityRepository extends JpaRepository<WorkflowEntity, UUID> {

    Optional<WorkflowEntity> findBySourceSystemAndSourceRecordId(String sourceSystem, String sourceRecordId);

    /**
     * States currently occupied by at least one entity of {@code workflowType}.
     */
    @Query("select distinct e.state from WorkflowEntity e where e.workflowType = :workflowType")
    List<String> findStatesInUse(@Param("workflowType") String workflowType);

    /**
     * Moves the entity to {@code state} and increments its version, only if the stored version still equals
     * {@code expectedVersion}. Must run inside a transaction.
     *
     * @return 1 when the write won, 0 when a concurrent writer changed the entity first
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update WorkflowEntity e set e.state = :state, e.version = e.version + 1, e.updatedAt = :updatedAt "
            + "where e.id = :id and e.version = :expectedVersion")
    int compareAndSetState(@Param("id") UUID id,
                           @Param("expectedVersion") long expectedVersion,
                           @Param("state") String state,
                           @Param("updatedAt") Instant updatedAt);
}
