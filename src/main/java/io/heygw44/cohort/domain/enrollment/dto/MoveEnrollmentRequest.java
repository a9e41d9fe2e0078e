package io.heygw44.cohort.domain.enrollment.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * 반 이동/과정 변경 요청 DTO
 * 같은 과정이면 반 이동, 다른 과정이면 과정 변경으로 처리된다.
 */
public record MoveEnrollmentRequest(
    @NotNull(message = "참여자를 선택해주세요")
    @Positive(message = "참여자 ID가 올바르지 않습니다")
    Long studentId,

    @NotNull(message = "이동할 반을 선택해주세요")
    @Positive(message = "반 ID가 올바르지 않습니다")
    Long newClassId
) {}
