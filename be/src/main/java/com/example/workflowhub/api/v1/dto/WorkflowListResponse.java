package com.example.workflowhub.api.v1.dto;

import java.util.List;

public record WorkflowListResponse(List<WorkflowListItem> workflows) {
}
