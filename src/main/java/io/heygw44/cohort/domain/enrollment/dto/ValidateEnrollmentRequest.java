package io.heygw44.cohort.domain.enrollment.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record ValidateEnrollmentRequest(
    @NotNull(message = "참여자를 선택해주세요")
    @Positive(message = "참여자 ID가 올바르지 않습니다")
    Long studentId,

    @NotNull(message = "반을 선택해주세요")
    @Positive(message = "반 ID가 올바르지 않습니다")
    Long classId
) {}
