package io.heygw44.cohort.domain.enrollment.service;

import io.heygw44.cohort.domain.courseclass.entity.CourseClass;
import io.heygw44.cohort.domain.courseclass.repository.CourseClassRepository;
import io.heygw44.cohort.domain.courseclass.service.CapacityLedger;
import io.heygw44.cohort.domain.enrollment.entity.Enrollment;
import io.heygw44.cohort.domain.enrollment.entity.EnrollmentStatus;
import io.heygw44.cohort.domain.enrollment.repository.EnrollmentRepository;
import io.heygw44.cohort.global.exception.BusinessException;
import io.heygw44.cohort.global.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * 수강 상태 전이 서비스
 * ACTIVE로 들어오거나 나가는 전이는 CapacityLedger와 같은 트랜잭션에서 일어난다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnrollmentStateMachine {

    private final EnrollmentRepository enrollmentRepository;
    private final CourseClassRepository courseClassRepository;
    private final CapacityLedger capacityLedger;

    /**
     * ACTIVE 수강 생성. 좌석 점유는 호출자 책임이다.
     * - 같은 (참여자, 반) 행이 ACTIVE: 그대로 반환
     * - COMPLETED: ENROLL-409-COMPLETED
     * - CANCELLED/TRANSFERRED: 기존 행을 다시 연다
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Enrollment create(Long studentId, Long classId, Long transferredFromClassId) {
        CourseClass courseClass = courseClassRepository.findById(classId)
            .orElseThrow(() -> new BusinessException(ErrorCode.CLASS_NOT_FOUND));

        Optional<Enrollment> existing = enrollmentRepository.findByStudentIdAndClassId(studentId, classId);
        if (existing.isPresent() && existing.get().isActive()) {
            return existing.get();
        }

        validateNoActiveInTrack(studentId, courseClass);

        if (existing.isPresent()) {
            Enrollment enrollment = existing.get();
            if (enrollment.isStatus(EnrollmentStatus.COMPLETED)) {
                throw new BusinessException(ErrorCode.ALREADY_COMPLETED_TRACK);
            }
            EnrollmentStatus previous = enrollment.getStatus();
            enrollment.reopen(transferredFromClassId);
            log.info("수강 재개: enrollmentId={}, studentId={}, classId={}, previousStatus={}",
                enrollment.getId(), studentId, classId, previous);
            return enrollment;
        }

        Enrollment saved;
        try {
            saved = enrollmentRepository.saveAndFlush(
                Enrollment.open(studentId, classId, transferredFromClassId));
        } catch (DataIntegrityViolationException ex) {
            // (student_id, class_id) 유니크 제약 위반
            throw new BusinessException(ErrorCode.ALREADY_ACTIVE_IN_TRACK);
        }

        log.info("수강 생성: enrollmentId={}, studentId={}, classId={}, transferredFromClassId={}",
            saved.getId(), studentId, classId, transferredFromClassId);
        return saved;
    }

    /**
     * 수료 처리 (ACTIVE → COMPLETED), 좌석 반납
     * 이미 COMPLETED면 아무것도 하지 않는다.
     */
    @Transactional
    public Enrollment complete(Long enrollmentId) {
        Enrollment enrollment = getEnrollmentForUpdate(enrollmentId);
        if (enrollment.isStatus(EnrollmentStatus.COMPLETED)) {
            return enrollment;
        }

        enrollment.complete();
        capacityLedger.release(enrollment.getClassId());

        log.info("수료 처리 완료: enrollmentId={}, studentId={}, classId={}",
            enrollmentId, enrollment.getStudentId(), enrollment.getClassId());
        return enrollment;
    }

    /**
     * 취소 (ACTIVE → CANCELLED), 좌석 반납
     */
    @Transactional
    public Enrollment cancel(Long enrollmentId) {
        Enrollment enrollment = getEnrollmentForUpdate(enrollmentId);

        enrollment.cancel();
        capacityLedger.release(enrollment.getClassId());

        log.info("수강 취소 완료: enrollmentId={}, studentId={}, classId={}",
            enrollmentId, enrollment.getStudentId(), enrollment.getClassId());
        return enrollment;
    }

    /**
     * 이동 처리 (ACTIVE → TRANSFERRED). 좌석은 반납하지 않는다.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Enrollment markTransferred(Long enrollmentId) {
        Enrollment enrollment = getEnrollmentForUpdate(enrollmentId);
        enrollment.markTransferred();

        log.info("수강 이동 처리: enrollmentId={}, studentId={}, classId={}",
            enrollmentId, enrollment.getStudentId(), enrollment.getClassId());
        return enrollment;
    }

    // === Private Helper Methods ===

    private Enrollment getEnrollmentForUpdate(Long enrollmentId) {
        return enrollmentRepository.findByIdForUpdate(enrollmentId)
            .orElseThrow(() -> new BusinessException(ErrorCode.ENROLLMENT_NOT_FOUND));
    }

    private void validateNoActiveInTrack(Long studentId, CourseClass courseClass) {
        boolean activeInTrack = enrollmentRepository.findHistoryInTrack(studentId, courseClass.getTrack())
            .stream()
            .anyMatch(Enrollment::isActive);
        if (activeInTrack) {
            throw new BusinessException(ErrorCode.ALREADY_ACTIVE_IN_TRACK);
        }
    }
}
