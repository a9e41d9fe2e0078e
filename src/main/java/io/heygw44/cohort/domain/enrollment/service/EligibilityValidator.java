package io.heygw44.cohort.domain.enrollment.service;

import io.heygw44.cohort.domain.courseclass.entity.CourseClass;
import io.heygw44.cohort.domain.courseclass.repository.CourseClassRepository;
import io.heygw44.cohort.domain.enrollment.dto.EligibilityReason;
import io.heygw44.cohort.domain.enrollment.dto.EligibilityResult;
import io.heygw44.cohort.domain.enrollment.entity.Enrollment;
import io.heygw44.cohort.domain.enrollment.entity.EnrollmentStatus;
import io.heygw44.cohort.domain.enrollment.repository.EnrollmentRepository;
import io.heygw44.cohort.domain.student.entity.Student;
import io.heygw44.cohort.domain.student.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 수강 자격 검증 (읽기 전용)
 * 검증 순서: 참여자 → 반 존재/운영 → 성별 제한 → 정원 → 과정 이력
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class EligibilityValidator {

    private final StudentRepository studentRepository;
    private final CourseClassRepository courseClassRepository;
    private final EnrollmentRepository enrollmentRepository;

    public EligibilityResult validate(Long studentId, Long classId) {
        Optional<Student> student = studentRepository.findById(studentId);
        if (student.isEmpty()) {
            return EligibilityResult.rejected(EligibilityReason.STUDENT_NOT_FOUND);
        }

        Optional<CourseClass> found = courseClassRepository.findById(classId);
        if (found.isEmpty()) {
            return EligibilityResult.rejected(EligibilityReason.CLASS_NOT_FOUND);
        }
        CourseClass courseClass = found.get();
        if (!courseClass.isOpenForEnrollment()) {
            return EligibilityResult.rejected(EligibilityReason.CLASS_INACTIVE);
        }
        if (!courseClass.admits(student.get().getGender())) {
            return EligibilityResult.rejected(EligibilityReason.GENDER_RESTRICTED);
        }
        // 최종 판정은 CapacityLedger가 행 락 아래에서 다시 한다
        if (!courseClass.hasVacancy()) {
            return EligibilityResult.rejected(EligibilityReason.CLASS_FULL);
        }

        return evaluateHistory(studentId, courseClass);
    }

    private EligibilityResult evaluateHistory(Long studentId, CourseClass courseClass) {
        List<Enrollment> history = enrollmentRepository.findHistoryInTrack(studentId, courseClass.getTrack());

        Optional<Enrollment> active = findFirst(history, EnrollmentStatus.ACTIVE);
        if (active.isPresent()) {
            return EligibilityResult.activeConflict(active.get().getId());
        }

        Optional<Enrollment> completed = findFirst(history, EnrollmentStatus.COMPLETED);
        if (completed.isPresent()) {
            return EligibilityResult.completed(completed.get().getCompletedAt());
        }

        for (Enrollment transferred : filter(history, EnrollmentStatus.TRANSFERRED)) {
            Optional<Enrollment> followUp = followTransferLineage(studentId, transferred, courseClass);
            if (followUp.isPresent()) {
                return EligibilityResult.activeConflict(followUp.get().getId());
            }
        }

        Optional<Enrollment> cancelled = findFirst(history, EnrollmentStatus.CANCELLED);
        if (cancelled.isPresent()) {
            return EligibilityResult.requiresConfirmation(cancelled.get().getCancelledAt());
        }

        return EligibilityResult.ok();
    }

    /**
     * TRANSFERRED 기록에서 transferredFromClassId 연결을 따라가 같은 과정의 ACTIVE 수강을 찾는다.
     */
    private Optional<Enrollment> followTransferLineage(Long studentId, Enrollment start, CourseClass target) {
        Set<Long> visited = new HashSet<>();
        Deque<Enrollment> queue = new ArrayDeque<>();
        queue.add(start);

        while (!queue.isEmpty()) {
            Enrollment current = queue.poll();
            if (!visited.add(current.getId())) {
                continue;
            }
            for (Enrollment next : enrollmentRepository.findByStudentIdAndTransferredFromClassId(
                    studentId, current.getClassId())) {
                if (!isInTrack(next, target)) {
                    continue;
                }
                if (next.isActive()) {
                    return Optional.of(next);
                }
                if (next.isStatus(EnrollmentStatus.TRANSFERRED)) {
                    queue.add(next);
                }
            }
        }
        return Optional.empty();
    }

    private boolean isInTrack(Enrollment enrollment, CourseClass target) {
        return courseClassRepository.findById(enrollment.getClassId())
            .map(target::isSameTrack)
            .orElse(false);
    }

    private Optional<Enrollment> findFirst(List<Enrollment> history, EnrollmentStatus status) {
        return history.stream().filter(e -> e.isStatus(status)).findFirst();
    }

    private List<Enrollment> filter(List<Enrollment> history, EnrollmentStatus status) {
        return history.stream().filter(e -> e.isStatus(status)).toList();
    }
}
