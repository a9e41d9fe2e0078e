package io.heygw44.cohort.domain.student.service;

import io.heygw44.cohort.domain.courseclass.repository.CourseClassRepository;
import io.heygw44.cohort.domain.enrollment.entity.EnrollmentStatus;
import io.heygw44.cohort.domain.enrollment.repository.EnrollmentRepository;
import io.heygw44.cohort.domain.student.dto.PriorityListResponse;
import io.heygw44.cohort.domain.student.entity.Student;
import io.heygw44.cohort.domain.student.repository.StudentRepository;
import io.heygw44.cohort.global.exception.BusinessException;
import io.heygw44.cohort.global.exception.ErrorCode;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PessimisticLockException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 우선 대기 명단 관리
 * 대기 표시와 ACTIVE 수강은 동시에 가질 수 없다.
 * 참여자 행 락 충돌은 TransferOrchestrator와 같은 정책으로 재시도한다.
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
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class PriorityListService {

    private final StudentRepository studentRepository;
    private final CourseClassRepository courseClassRepository;
    private final EnrollmentRepository enrollmentRepository;

    /**
     * 우선 대기 명단 등록 (이미 등록돼 있으면 희망 반/시각 갱신)
     */
    @Transactional
    public PriorityListResponse addToPriorityList(Long studentId, Long classId) {
        if (!courseClassRepository.existsById(classId)) {
            throw new BusinessException(ErrorCode.CLASS_NOT_FOUND);
        }

        Student student = studentRepository.findByIdForUpdate(studentId)
            .orElseThrow(() -> new BusinessException(ErrorCode.STUDENT_NOT_FOUND));

        if (enrollmentRepository.existsByStudentIdAndStatus(studentId, EnrollmentStatus.ACTIVE)) {
            throw new BusinessException(ErrorCode.ALREADY_ACTIVELY_ENROLLED);
        }

        student.markPriority(classId);

        log.info("우선 대기 명단 등록: studentId={}, classId={}", studentId, classId);
        return PriorityListResponse.from(student);
    }

    /**
     * 우선 대기 명단 해제 (운영자 판단)
     */
    @Transactional
    public PriorityListResponse removeFromPriorityList(Long studentId, Long actorId) {
        Student student = studentRepository.findByIdForUpdate(studentId)
            .orElseThrow(() -> new BusinessException(ErrorCode.STUDENT_NOT_FOUND));

        if (!student.isPriorityListed()) {
            throw new BusinessException(ErrorCode.PRIORITY_LIST_NOT_MARKED);
        }
        student.clearPriority();

        log.info("우선 대기 명단 해제: studentId={}, actorId={}", studentId, actorId);
        return PriorityListResponse.from(student);
    }
}
