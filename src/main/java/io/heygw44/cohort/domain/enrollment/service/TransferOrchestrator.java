package io.heygw44.cohort.domain.enrollment.service;

import io.heygw44.cohort.domain.courseclass.entity.CourseClass;
import io.heygw44.cohort.domain.courseclass.repository.CourseClassRepository;
import io.heygw44.cohort.domain.courseclass.service.CapacityLedger;
import io.heygw44.cohort.domain.enrollment.dto.EligibilityResult;
import io.heygw44.cohort.domain.enrollment.dto.EnrollmentResponse;
import io.heygw44.cohort.domain.enrollment.entity.Enrollment;
import io.heygw44.cohort.domain.enrollment.entity.EnrollmentStatus;
import io.heygw44.cohort.domain.enrollment.event.ClassSummary;
import io.heygw44.cohort.domain.enrollment.event.EnrollmentMovedEvent;
import io.heygw44.cohort.domain.enrollment.event.MoveType;
import io.heygw44.cohort.domain.enrollment.repository.EnrollmentRepository;
import io.heygw44.cohort.domain.student.entity.Student;
import io.heygw44.cohort.domain.student.repository.StudentRepository;
import io.heygw44.cohort.global.exception.BusinessException;
import io.heygw44.cohort.global.exception.EnrollmentInvariantException;
import io.heygw44.cohort.global.exception.ErrorCode;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PessimisticLockException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 등록/반 이동/과정 변경 오케스트레이터
 * 각 작업은 하나의 트랜잭션이며, 락 획득 순서는 수강 행 → 참여자 행 → 반 행(id 오름차순)이다.
 * 락 충돌은 새 트랜잭션으로 재시도하고, 재시도를 모두 소진하면 REQ-409-BUSY로 응답한다.
 */
@Service
@Retryable(
    retryFor = {
        PessimisticLockingFailureException.class,
        OptimisticLockingFailureException.class,
        PessimisticLockException.class,
        LockTimeoutException.class,
        OptimisticLockException.class
    },
    maxAttemptsExpression = "${app.enrollment.retry.max-attempts:3}",
    backoff = @Backoff(
        delayExpression = "${app.enrollment.retry.backoff-delay-ms:100}",
        multiplierExpression = "${app.enrollment.retry.backoff-multiplier:2}"
    ),
    listeners = "lockConflictRetryListener"
)
@RequiredArgsConstructor
@Slf4j
public class TransferOrchestrator {

    private final StudentRepository studentRepository;
    private final CourseClassRepository courseClassRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final EligibilityValidator eligibilityValidator;
    private final EnrollmentStateMachine enrollmentStateMachine;
    private final CapacityLedger capacityLedger;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * 신규 수강 등록
     * 같은 반에 이미 ACTIVE면 기존 수강을 그대로 반환한다.
     * @param confirmReEnrollment 같은 과정 취소 이력이 있을 때 재등록 확인 여부
     */
    @Transactional
    public EnrollmentResponse register(Long studentId, Long classId, boolean confirmReEnrollment) {
        Student student = getStudentForUpdate(studentId);
        Enrollment enrollment = registerLocked(student, classId, confirmReEnrollment);
        return EnrollmentResponse.from(enrollment);
    }

    /**
     * 같은 과정 내 반 이동 (이전 수강은 TRANSFERRED)
     */
    @Transactional
    public EnrollmentResponse transferSameTrack(Long studentId, Long oldEnrollmentId, Long newClassId,
                                                Long actorId) {
        return moveLocked(studentId, oldEnrollmentId, newClassId, actorId, MoveType.TRANSFER);
    }

    /**
     * 다른 과정으로 변경 (이전 수강은 CANCELLED)
     */
    @Transactional
    public EnrollmentResponse changeTrack(Long studentId, Long oldEnrollmentId, Long newClassId,
                                          Long actorId) {
        return moveLocked(studentId, oldEnrollmentId, newClassId, actorId, MoveType.TRACK_CHANGE);
    }

    /**
     * 두 반의 과정을 비교해 반 이동 또는 과정 변경으로 처리
     */
    @Transactional
    public EnrollmentResponse move(Long studentId, Long oldEnrollmentId, Long newClassId, Long actorId) {
        return moveLocked(studentId, oldEnrollmentId, newClassId, actorId, null);
    }

    /**
     * 우선 대기 명단 참여자 등록. 등록과 같은 트랜잭션에서 대기 표시를 해제한다.
     */
    @Transactional
    public EnrollmentResponse enrollFromPriorityList(Long studentId, Long classId, Long actorId) {
        Student student = getStudentForUpdate(studentId);
        if (!student.isPriorityListed()) {
            throw new BusinessException(ErrorCode.PRIORITY_LIST_NOT_MARKED);
        }

        Enrollment enrollment = registerLocked(student, classId, true);
        student.clearPriority();

        log.info("우선 대기 명단 등록 완료: studentId={}, classId={}, enrollmentId={}, actorId={}",
            studentId, classId, enrollment.getId(), actorId);
        return EnrollmentResponse.from(enrollment);
    }

    /**
     * 운영자 수강 취소 (좌석 반납)
     */
    @Transactional
    public EnrollmentResponse cancelEnrollment(Long enrollmentId, Long actorId) {
        Enrollment enrollment = enrollmentStateMachine.cancel(enrollmentId);
        log.info("운영자 수강 취소: enrollmentId={}, actorId={}", enrollmentId, actorId);
        return EnrollmentResponse.from(enrollment);
    }

    /**
     * 운영자 수료 처리. 이미 수료면 그대로 성공한다.
     */
    @Transactional
    public EnrollmentResponse completeEnrollment(Long enrollmentId, Long actorId) {
        Enrollment enrollment = enrollmentStateMachine.complete(enrollmentId);
        log.info("운영자 수료 처리: enrollmentId={}, actorId={}", enrollmentId, actorId);
        return EnrollmentResponse.from(enrollment);
    }

    // === Private Helper Methods ===

    private Enrollment registerLocked(Student student, Long classId, boolean confirmReEnrollment) {
        Long studentId = student.getId();

        // 1. 중복 요청 → 좌석 재점유 없이 기존 수강 반환
        Optional<Enrollment> existing = enrollmentRepository.findByStudentIdAndClassId(studentId, classId);
        if (existing.isPresent() && existing.get().isActive()) {
            log.info("이미 수강 중인 반: studentId={}, classId={}, enrollmentId={}",
                studentId, classId, existing.get().getId());
            return existing.get();
        }

        // 2. 자격 검증 (참여자 락 아래에서 다시 수행)
        EligibilityResult eligibility = eligibilityValidator.validate(studentId, classId);
        eligibility.throwIfRejected();
        if (eligibility.requiresConfirmation() && !confirmReEnrollment) {
            throw new BusinessException(ErrorCode.REENROLLMENT_CONFIRMATION_REQUIRED, eligibility.details());
        }

        // 3. 좌석 점유 → 수강 생성
        capacityLedger.reserve(classId);
        Enrollment enrollment = enrollmentStateMachine.create(studentId, classId, null);

        log.info("수강 등록 완료: studentId={}, classId={}, enrollmentId={}",
            studentId, classId, enrollment.getId());
        return enrollment;
    }

    private EnrollmentResponse moveLocked(Long studentId, Long oldEnrollmentId, Long newClassId,
                                          Long actorId, MoveType requestedType) {
        // 1. 이전 수강 락 및 소유 확인
        Enrollment oldEnrollment = enrollmentRepository.findByIdForUpdate(oldEnrollmentId)
            .orElseThrow(() -> new BusinessException(ErrorCode.ENROLLMENT_NOT_FOUND));
        if (!oldEnrollment.belongsToStudent(studentId)) {
            throw new BusinessException(ErrorCode.ENROLLMENT_NOT_OWNED);
        }
        if (oldEnrollment.isInClass(newClassId)) {
            throw new BusinessException(ErrorCode.ALREADY_SAME_CLASS);
        }

        // 2. 참여자 락 → 두 반 락 (id 오름차순)
        Student student = getStudentForUpdate(studentId);
        Long oldClassId = oldEnrollment.getClassId();
        Map<Long, CourseClass> classes = lockClasses(oldClassId, newClassId);
        CourseClass oldClass = classes.get(oldClassId);
        if (oldClass == null) {
            throw new EnrollmentInvariantException(
                "enrollment references missing class: enrollmentId=" + oldEnrollmentId + ", classId=" + oldClassId);
        }
        CourseClass newClass = classes.get(newClassId);
        if (newClass == null) {
            throw new BusinessException(ErrorCode.CLASS_NOT_FOUND);
        }

        MoveType moveType = oldClass.isSameTrack(newClass) ? MoveType.TRANSFER : MoveType.TRACK_CHANGE;
        if (requestedType != null && requestedType != moveType) {
            throw new BusinessException(ErrorCode.TRACK_MISMATCH);
        }

        // 3. 대상 반에 이미 ACTIVE 수강이 있는 경우
        Optional<Enrollment> target = enrollmentRepository.findByStudentIdAndClassId(studentId, newClassId);
        if (target.isPresent() && target.get().isActive()) {
            return closeOldAndKeepTarget(oldEnrollment, target.get(), moveType, actorId);
        }

        if (!oldEnrollment.isActive()) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION);
        }
        validateMoveTarget(student, newClass, target.orElse(null), moveType);

        // 4. 새 반 좌석 점유 → 이전 수강 종료 → 새 수강 생성
        capacityLedger.reserve(newClassId);
        if (moveType == MoveType.TRANSFER) {
            enrollmentStateMachine.markTransferred(oldEnrollment.getId());
            capacityLedger.release(oldClassId);
        } else {
            enrollmentStateMachine.cancel(oldEnrollment.getId());
        }
        Enrollment moved = enrollmentStateMachine.create(studentId, newClassId, oldClassId);

        eventPublisher.publishEvent(new EnrollmentMovedEvent(
            studentId, moved.getId(), moveType,
            ClassSummary.from(oldClass), ClassSummary.from(newClass), actorId));

        log.info("수강 이동 완료: moveType={}, studentId={}, fromClassId={}, toClassId={}, enrollmentId={}, actorId={}",
            moveType, studentId, oldClassId, newClassId, moved.getId(), actorId);
        return EnrollmentResponse.from(moved);
    }

    /**
     * 대상 반 수강이 이미 ACTIVE일 때.
     * 이전 수강이 이미 닫혀 있으면 재요청이므로 그대로 반환하고,
     * 과정 변경이면 이전 수강만 취소(좌석 반납)한 뒤 대상 수강을 반환한다. 대상 반 좌석은 다시 점유하지 않는다.
     */
    private EnrollmentResponse closeOldAndKeepTarget(Enrollment oldEnrollment, Enrollment target,
                                                     MoveType moveType, Long actorId) {
        if (!oldEnrollment.isActive()) {
            log.info("이미 이동된 수강: studentId={}, classId={}, enrollmentId={}",
                target.getStudentId(), target.getClassId(), target.getId());
            return EnrollmentResponse.from(target);
        }
        if (moveType == MoveType.TRANSFER) {
            throw new EnrollmentInvariantException(
                "two active enrollments in one track: enrollmentIds=" + oldEnrollment.getId() + "," + target.getId());
        }

        enrollmentStateMachine.cancel(oldEnrollment.getId());

        log.info("과정 변경 - 대상 반 기존 수강 유지: studentId={}, fromClassId={}, toClassId={}, enrollmentId={}, actorId={}",
            target.getStudentId(), oldEnrollment.getClassId(), target.getClassId(), target.getId(), actorId);
        return EnrollmentResponse.from(target);
    }

    private void validateMoveTarget(Student student, CourseClass newClass, Enrollment existingTarget,
                                    MoveType moveType) {
        if (moveType == MoveType.TRACK_CHANGE) {
            // 대상 과정의 이력까지 확인. 취소 이력은 확인 없이 기존 행을 다시 연다.
            eligibilityValidator.validate(student.getId(), newClass.getId()).throwIfRejected();
            return;
        }

        if (!newClass.isOpenForEnrollment()) {
            throw new BusinessException(ErrorCode.CLASS_INACTIVE);
        }
        if (!newClass.admits(student.getGender())) {
            throw new BusinessException(ErrorCode.GENDER_RESTRICTED);
        }
        if (existingTarget != null && existingTarget.isStatus(EnrollmentStatus.COMPLETED)) {
            throw new BusinessException(ErrorCode.ALREADY_COMPLETED_TRACK);
        }
    }

    private Student getStudentForUpdate(Long studentId) {
        return studentRepository.findByIdForUpdate(studentId)
            .orElseThrow(() -> new BusinessException(ErrorCode.STUDENT_NOT_FOUND));
    }

    private Map<Long, CourseClass> lockClasses(Long firstClassId, Long secondClassId) {
        List<CourseClass> locked = courseClassRepository.findAllByIdForUpdate(List.of(firstClassId, secondClassId));
        return locked.stream().collect(Collectors.toMap(CourseClass::getId, Function.identity()));
    }
}
