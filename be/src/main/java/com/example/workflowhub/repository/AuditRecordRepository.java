package com.example.workflowhub.repository;

import com.example.workflowhub.domain.AuditRecord;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AuditRecordRepository extends JpaRepository<AuditRecord, Long> {

    List<AuditRecord> findByEntityIdOrderByIdAsc(UUID entityId);
}
