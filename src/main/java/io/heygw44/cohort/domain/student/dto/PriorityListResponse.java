package io.heygw44.cohort.domain.student.dto;

import io.heygw44.cohort.domain.student.entity.Student;

import java.time.LocalDateTime;

/**
 * 우선 대기 명단 상태 응답 DTO
 */
public record PriorityListResponse(
    Long studentId,
    boolean priorityListed,
    Long priorityClassId,
    LocalDateTime priorityListedAt
) {
    public static PriorityListResponse from(Student student) {
        return new PriorityListResponse(
            student.getId(),
            student.isPriorityListed(),
            student.getPriorityClassId(),
            student.getPriorityListedAt()
        );
    }
}
