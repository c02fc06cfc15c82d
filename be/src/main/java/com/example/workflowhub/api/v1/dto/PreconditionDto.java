package com.example.workflowhub.api.v1.dto;

import java.util.List;

public record PreconditionDto(
        String field,
        String operator,
        String value,
        List<String> values
) {}
