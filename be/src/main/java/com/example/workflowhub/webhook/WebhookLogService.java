package com.example.workflowhub.webhook;

import com.example.workflowhub.domain.WebhookLogRecord;
import com.example.workflowhub.domain.WebhookOutcome;
import com.example.workflowhub.repository.WebhookLogRepository;

import com.google.common.hash.Hashing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Writes and reads the webhook attempt log. Bodies are reduced to a SHA-256 digest and a size.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookLogService {

    static final int MAX_ERROR_LENGTH = 500;

    private final WebhookLogRepository repository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public WebhookLogRecord record(String source, String eventType, String caller, WebhookOutcome outcome,
                                   byte[] body, String errorMessage) {
        byte[] bytes = body != null ? body : new byte[0];
        WebhookLogRecord saved = repository.save(new WebhookLogRecord(
                source,
                eventType,
                caller,
                outcome,
                Hashing.sha256().hashBytes(bytes).toString(),
                bytes.length,
                truncate(errorMessage),
                Instant.now()));
        log.info("Webhook source={} eventType={} caller={} outcome={} size={}", source, eventType, caller, outcome, bytes.length);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<WebhookLogRecord> findRecent(String source) {
        return source == null || source.isBlank()
                ? repository.findTop100ByOrderByIdDesc()
                : repository.findTop100BySourceOrderByIdDesc(source);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
