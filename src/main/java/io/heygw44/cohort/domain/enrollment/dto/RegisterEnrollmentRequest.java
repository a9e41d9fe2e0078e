package io.heygw44.cohort.domain.enrollment.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * 수강 등록 요청 DTO
 * @param confirmReEnrollment 취소 이력이 있는 과정에 다시 등록하는 것을 확인했는지
 */
public record RegisterEnrollmentRequest(
    @NotNull(message = "참여자를 선택해주세요")
    @Positive(message = "참여자 ID가 올바르지 않습니다")
    Long studentId,

    @NotNull(message = "반을 선택해주세요")
    @Positive(message = "반 ID가 올바르지 않습니다")
    Long classId,

    boolean confirmReEnrollment
) {}
