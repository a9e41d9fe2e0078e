package io.heygw44.cohort.domain.admin.dto;

public record LoginResponse(
        Long adminId,
        String email,
        String name
) {}
