package io.heygw44.cohort.domain.enrollment.service;

import io.heygw44.cohort.domain.courseclass.dto.AvailableClassesResponse;
import io.heygw44.cohort.domain.courseclass.dto.AvailableClassesResponse.TrackClasses;
import io.heygw44.cohort.domain.courseclass.dto.CapacitySnapshot;
import io.heygw44.cohort.domain.courseclass.dto.CourseClassResponse;
import io.heygw44.cohort.domain.courseclass.entity.CourseClass;
import io.heygw44.cohort.domain.courseclass.entity.ProgramTrack;
import io.heygw44.cohort.domain.courseclass.repository.CourseClassRepository;
import io.heygw44.cohort.domain.courseclass.service.CapacityLedger;
import io.heygw44.cohort.domain.enrollment.dto.RosterEntry;
import io.heygw44.cohort.domain.enrollment.dto.RosterResponse;
import io.heygw44.cohort.domain.enrollment.entity.Enrollment;
import io.heygw44.cohort.domain.enrollment.entity.EnrollmentStatus;
import io.heygw44.cohort.domain.enrollment.repository.EnrollmentRepository;
import io.heygw44.cohort.domain.student.entity.Student;
import io.heygw44.cohort.domain.student.repository.StudentRepository;
import io.heygw44.cohort.global.exception.BusinessException;
import io.heygw44.cohort.global.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 수강 조회 서비스 (신청 가능 반, 반별 명단)
 */
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class EnrollmentQueryService {

    private static final List<EnrollmentStatus> BLOCKING_STATUSES =
        List.of(EnrollmentStatus.ACTIVE, EnrollmentStatus.COMPLETED);

    private final StudentRepository studentRepository;
    private final CourseClassRepository courseClassRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final CapacityLedger capacityLedger;

    /**
     * 신청 가능한 반 목록
     * 수강 중이거나 수료한 과정, 성별 제한 반, 정원이 찬 반은 제외한다.
     */
    public AvailableClassesResponse getAvailableClasses(Long studentId) {
        Student student = studentRepository.findById(studentId)
            .orElseThrow(() -> new BusinessException(ErrorCode.STUDENT_NOT_FOUND));

        List<ProgramTrack> excludedTracks =
            enrollmentRepository.findTracksByStudentIdAndStatusIn(studentId, BLOCKING_STATUSES);

        // NOT IN () 는 DB마다 동작이 달라 빈 목록이면 별도 쿼리를 쓴다
        List<CourseClass> openClasses = excludedTracks.isEmpty()
            ? courseClassRepository.findOpenClasses()
            : courseClassRepository.findOpenClassesExcludingTracks(excludedTracks);

        Map<ProgramTrack, List<CourseClassResponse>> grouped = openClasses.stream()
            .filter(c -> c.admits(student.getGender()))
            .filter(CourseClass::hasVacancy)
            .collect(Collectors.groupingBy(
                CourseClass::getTrack,
                () -> new EnumMap<>(ProgramTrack.class),
                Collectors.mapping(CourseClassResponse::from, Collectors.toList())
            ));

        List<TrackClasses> tracks = grouped.entrySet().stream()
            .map(entry -> new TrackClasses(entry.getKey(), entry.getValue()))
            .toList();

        return new AvailableClassesResponse(studentId, tracks);
    }

    /**
     * 반별 수강 명단 (운영자용)
     */
    public RosterResponse getClassRoster(Long classId) {
        if (!courseClassRepository.existsById(classId)) {
            throw new BusinessException(ErrorCode.CLASS_NOT_FOUND);
        }

        List<Enrollment> enrollments = enrollmentRepository.findByClassIdOrderByCreatedAtAsc(classId);

        // 참여자 정보 배치 조회 (N+1 방지)
        List<Long> studentIds = enrollments.stream()
            .map(Enrollment::getStudentId)
            .distinct()
            .toList();
        Map<Long, Student> students = studentRepository.findAllById(studentIds).stream()
            .collect(Collectors.toMap(Student::getId, Function.identity()));

        List<RosterEntry> entries = enrollments.stream()
            .map(e -> {
                Student student = students.get(e.getStudentId());
                return RosterEntry.from(e,
                    student != null ? student.getName() : null,
                    student != null ? student.getPhone() : null);
            })
            .toList();

        CapacitySnapshot snapshot = capacityLedger.snapshot(classId);
        return new RosterResponse(entries, entries.size(), snapshot);
    }

    public CapacitySnapshot getCapacity(Long classId) {
        return capacityLedger.snapshot(classId);
    }
}
