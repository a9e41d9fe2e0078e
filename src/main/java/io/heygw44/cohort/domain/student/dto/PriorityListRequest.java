package io.heygw44.cohort.domain.student.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record PriorityListRequest(
    @NotNull(message = "희망 반을 선택해주세요")
    @Positive(message = "반 ID가 올바르지 않습니다")
    Long classId
) {}
