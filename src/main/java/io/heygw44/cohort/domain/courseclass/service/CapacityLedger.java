package io.heygw44.cohort.domain.courseclass.service;

import io.heygw44.cohort.domain.courseclass.dto.CapacitySnapshot;
import io.heygw44.cohort.domain.courseclass.entity.CourseClass;

/**
 * 반 정원 카운터(enrolledCount)의 유일한 변경 경로.
 * reserve/release는 호출자의 트랜잭션 안에서만 실행된다.
 */
public interface CapacityLedger {

    /**
     * 좌석 1개 점유
     * @throws io.heygw44.cohort.global.exception.BusinessException CLASS_NOT_FOUND, CLASS_INACTIVE, CLASS_FULL
     */
    CourseClass reserve(Long classId);

    /**
     * 좌석 1개 반납
     * @throws io.heygw44.cohort.global.exception.EnrollmentInvariantException 카운터가 0 미만이 되는 경우
     */
    CourseClass release(Long classId);

    /**
     * 정원 현황 조회 (읽기 전용, 불일치는 보정하지 않고 기록만 한다)
     */
    CapacitySnapshot snapshot(Long classId);
}
