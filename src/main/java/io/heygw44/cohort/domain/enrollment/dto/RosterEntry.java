package io.heygw44.cohort.domain.enrollment.dto;

import io.heygw44.cohort.domain.enrollment.entity.Enrollment;
import io.heygw44.cohort.domain.enrollment.entity.EnrollmentStatus;

import java.time.LocalDateTime;

public record RosterEntry(
    Long enrollmentId,
    Long studentId,
    String studentName,
    String studentPhone,
    EnrollmentStatus status,
    Long transferredFromClassId,
    LocalDateTime createdAt
) {
    public static RosterEntry from(Enrollment enrollment, String studentName, String studentPhone) {
        return new RosterEntry(
            enrollment.getId(),
            enrollment.getStudentId(),
            studentName,
            studentPhone,
            enrollment.getStatus(),
            enrollment.getTransferredFromClassId(),
            enrollment.getCreatedAt()
        );
    }
}
