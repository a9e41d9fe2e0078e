package io.heygw44.cohort.domain.courseclass.dto;

/**
 * 반 정원 현황
 * @param consistent 캐시된 enrolledCount와 실제 ACTIVE 건수 일치 여부
 */
public record CapacitySnapshot(
    Long classId,
    int capacity,
    int enrolledCount,
    long activeEnrollmentCount,
    int availableSeats,
    boolean consistent
) {
}
