package io.heygw44.cohort.domain.enrollment.dto;

import io.heygw44.cohort.domain.courseclass.dto.CapacitySnapshot;

import java.util.List;

/**
 * 반별 수강 목록 응답 DTO (운영자용)
 */
public record RosterResponse(
    List<RosterEntry> enrollments,
    long totalCount,
    CapacitySnapshot capacity
) {
}
