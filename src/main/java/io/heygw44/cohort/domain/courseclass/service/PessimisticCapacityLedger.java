package io.heygw44.cohort.domain.courseclass.service;

import io.heygw44.cohort.domain.courseclass.dto.CapacitySnapshot;
import io.heygw44.cohort.domain.courseclass.entity.CourseClass;
import io.heygw44.cohort.domain.enrollment.entity.EnrollmentStatus;
import io.heygw44.cohort.domain.enrollment.repository.EnrollmentRepository;
import io.heygw44.cohort.global.exception.BusinessException;
import io.heygw44.cohort.global.exception.ErrorCode;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * 행 단위 비관적 락(SELECT ... FOR UPDATE) 기반 정원 원장
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PessimisticCapacityLedger implements CapacityLedger {

    private static final Map<String, Object> LOCK_HINTS =
        Map.of("jakarta.persistence.lock.timeout", 3000);

    private final EnrollmentRepository enrollmentRepository;

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public CourseClass reserve(Long classId) {
        CourseClass courseClass = lockForUpdate(classId);
        courseClass.reserveSeat();

        log.info("좌석 점유: classId={}, enrolledCount={}, capacity={}",
            classId, courseClass.getEnrolledCount(), courseClass.getCapacity());
        return courseClass;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public CourseClass release(Long classId) {
        CourseClass courseClass = lockForUpdate(classId);
        courseClass.releaseSeat();

        log.info("좌석 반납: classId={}, enrolledCount={}, capacity={}",
            classId, courseClass.getEnrolledCount(), courseClass.getCapacity());
        return courseClass;
    }

    @Override
    @Transactional(readOnly = true)
    public CapacitySnapshot snapshot(Long classId) {
        CourseClass courseClass = entityManager.find(CourseClass.class, classId);
        if (courseClass == null) {
            throw new BusinessException(ErrorCode.CLASS_NOT_FOUND);
        }

        long activeCount = enrollmentRepository.countByClassIdAndStatus(classId, EnrollmentStatus.ACTIVE);
        boolean consistent = activeCount == courseClass.getEnrolledCount();
        if (!consistent) {
            log.error("정원 카운터 불일치: classId={}, enrolledCount={}, activeCount={}",
                classId, courseClass.getEnrolledCount(), activeCount);
        }

        return new CapacitySnapshot(
            classId,
            courseClass.getCapacity(),
            courseClass.getEnrolledCount(),
            activeCount,
            courseClass.availableSeats(),
            consistent
        );
    }

    /**
     * 같은 트랜잭션에서 먼저 읽어 둔 인스턴스가 있어도 최신 행을 잠근 상태로 다시 읽는다.
     * refresh는 미반영 변경을 버리므로 먼저 flush 한다.
     */
    private CourseClass lockForUpdate(Long classId) {
        CourseClass courseClass = entityManager.find(CourseClass.class, classId);
        if (courseClass == null) {
            throw new BusinessException(ErrorCode.CLASS_NOT_FOUND);
        }
        entityManager.flush();
        entityManager.refresh(courseClass, LockModeType.PESSIMISTIC_WRITE, LOCK_HINTS);
        return courseClass;
    }
}
