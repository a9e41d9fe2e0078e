package io.heygw44.cohort.domain.enrollment.dto;

import io.heygw44.cohort.domain.enrollment.entity.Enrollment;
import io.heygw44.cohort.domain.enrollment.entity.EnrollmentStatus;

import java.time.LocalDateTime;

/**
 * 수강 응답 DTO
 */
public record EnrollmentResponse(
    Long id,
    Long studentId,
    Long classId,
    EnrollmentStatus status,
    Long transferredFromClassId,
    LocalDateTime createdAt,
    LocalDateTime completedAt,
    LocalDateTime cancelledAt,
    LocalDateTime updatedAt
) {
    public static EnrollmentResponse from(Enrollment enrollment) {
        return new EnrollmentResponse(
            enrollment.getId(),
            enrollment.getStudentId(),
            enrollment.getClassId(),
            enrollment.getStatus(),
            enrollment.getTransferredFromClassId(),
            enrollment.getCreatedAt(),
            enrollment.getCompletedAt(),
            enrollment.getCancelledAt(),
            enrollment.getUpdatedAt()
        );
    }
}
