package com.example.workflowhub.repository;

import com.example.workflowhub.domain.WebhookLogRecord;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WebhookLogRepository extends JpaRepository<WebhookLogRecord, Long> {

    List<WebhookLogRecord> findTop100ByOrderByIdDesc();

    List<WebhookLogRecord> findTop100BySourceOrderByIdDesc(String source);
}
