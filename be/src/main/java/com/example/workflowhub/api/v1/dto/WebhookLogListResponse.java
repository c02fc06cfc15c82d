package com.example.workflowhub.api.v1.dto;

import java.util.List;

/**
 * Response for GET /api/v1/webhooks/logs: most recent attempts first.
 */
public record WebhookLogListResponse(List<WebhookLogResponse> logs) {}
