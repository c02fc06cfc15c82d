package com.example.workflowhub.api.v1.dto;

import java.util.List;
import java.util.UUID;

/**
 * Response for GET /api/v1/entities/{id}/audit, oldest record first.
 */
public record AuditTrailResponse(UUID entityId, List<AuditRecordResponse> records) {}
