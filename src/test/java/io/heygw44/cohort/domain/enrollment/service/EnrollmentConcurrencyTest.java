package io.heygw44.cohort.domain.enrollment.service;

import io.heygw44.cohort.domain.courseclass.entity.ClassFormat;
import io.heygw44.cohort.domain.courseclass.entity.CourseClass;
import io.heygw44.cohort.domain.courseclass.entity.ProgramTrack;
import io.heygw44.cohort.domain.courseclass.repository.CourseClassRepository;
import io.heygw44.cohort.domain.enrollment.dto.EnrollmentResponse;
import io.heygw44.cohort.domain.enrollment.entity.EnrollmentStatus;
import io.heygw44.cohort.domain.enrollment.repository.EnrollmentRepository;
import io.heygw44.cohort.domain.student.entity.Gender;
import io.heygw44.cohort.domain.student.entity.Student;
import io.heygw44.cohort.domain.student.repository.StudentRepository;
import io.heygw44.cohort.global.exception.ErrorCode;
import io.heygw44.cohort.support.ConcurrencyTestHelper;
import io.heygw44.cohort.support.ConcurrencyTestHelper.Outcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("local")
@DisplayName("수강 등록/이동 동시성 테스트")
class EnrollmentConcurrencyTest {

    private static final Logger log = LoggerFactory.getLogger(EnrollmentConcurrencyTest.class);
    private static final Duration START_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DONE_TIMEOUT = Duration.ofSeconds(120);
    private static final AtomicInteger PHONE_SEQ = new AtomicInteger(5000);

    @Autowired
    private TransferOrchestrator transferOrchestrator;

    @Autowired
    private StudentRepository studentRepository;

    @Autowired
    private CourseClassRepository courseClassRepository;

    @Autowired
    private EnrollmentRepository enrollmentRepository;

    @AfterEach
    void tearDown() {
        enrollmentRepository.deleteAll();
        studentRepository.deleteAll();
        courseClassRepository.deleteAll();
    }

    @ParameterizedTest(name = "정원 {0}명에 {1}명 동시 등록 → 성공 min(N, C)")
    @CsvSource({"10, 30", "5, 5", "20, 8"})
    @DisplayName("정원 C인 반에 N명이 동시에 등록하면 정확히 min(N, C)명만 성공")
    void register_concurrent_neverExceedsCapacity(int capacity, int requestCount) {
        CourseClass courseClass = createClass(ProgramTrack.CHURCH, capacity);
        List<Callable<EnrollmentResponse>> tasks = new ArrayList<>();
        for (int i = 0; i < requestCount; i++) {
            Long studentId = createStudent().getId();
            tasks.add(() -> transferOrchestrator.register(studentId, courseClass.getId(), false));
        }

        Outcome<EnrollmentResponse> outcome = ConcurrencyTestHelper.runConcurrently(
            tasks, START_TIMEOUT, DONE_TIMEOUT);
        outcome.logUnexpected(log);

        int expected = Math.min(capacity, requestCount);
        assertThat(outcome.unexpected()).isEmpty();
        assertThat(outcome.successes()).hasSize(expected);
        assertThat(outcome.rejected(ErrorCode.CLASS_FULL)).isEqualTo(requestCount - expected);

        CourseClass reloaded = courseClassRepository.findById(courseClass.getId()).orElseThrow();
        assertThat(reloaded.getEnrolledCount()).isEqualTo(expected);
        assertThat(enrollmentRepository.countByClassIdAndStatus(courseClass.getId(), EnrollmentStatus.ACTIVE))
            .isEqualTo(expected);
    }

    @Test
    @DisplayName("한 참여자가 같은 과정 여러 반에 동시에 등록해도 ACTIVE는 1건")
    void register_concurrentSameTrack_singleActive() {
        Student student = createStudent();
        List<CourseClass> classes = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            classes.add(createClass(ProgramTrack.SPIRITUALITY, 10));
        }
        List<Callable<EnrollmentResponse>> tasks = new ArrayList<>();
        for (CourseClass courseClass : classes) {
            tasks.add(() -> transferOrchestrator.register(student.getId(), courseClass.getId(), false));
        }

        Outcome<EnrollmentResponse> outcome = ConcurrencyTestHelper.runConcurrently(
            tasks, START_TIMEOUT, DONE_TIMEOUT);
        outcome.logUnexpected(log);

        assertThat(outcome.unexpected()).isEmpty();
        assertThat(outcome.successes()).hasSize(1);
        assertThat(outcome.rejected(ErrorCode.ALREADY_ACTIVE_IN_TRACK)).isEqualTo(classes.size() - 1);

        int totalEnrolled = classes.stream()
            .mapToInt(c -> courseClassRepository.findById(c.getId()).orElseThrow().getEnrolledCount())
            .sum();
        assertThat(totalEnrolled).isEqualTo(1);
    }

    @Test
    @DisplayName("같은 반 중복 등록 요청이 동시에 와도 수강 1건, 좌석 1개")
    void register_concurrentDuplicate_singleSeat() {
        Student student = createStudent();
        CourseClass courseClass = createClass(ProgramTrack.GOSPEL, 10);
        List<Callable<EnrollmentResponse>> tasks = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            tasks.add(() -> transferOrchestrator.register(student.getId(), courseClass.getId(), false));
        }

        Outcome<EnrollmentResponse> outcome = ConcurrencyTestHelper.runConcurrently(
            tasks, START_TIMEOUT, DONE_TIMEOUT);
        outcome.logUnexpected(log);

        assertThat(outcome.unexpected()).isEmpty();
        assertThat(outcome.successes()).hasSize(8);
        assertThat(outcome.successes()).extracting(EnrollmentResponse::id).containsOnly(outcome.successes().get(0).id());
        assertThat(courseClassRepository.findById(courseClass.getId()).orElseThrow().getEnrolledCount())
            .isEqualTo(1);
    }

    @Test
    @DisplayName("A→B, B→A 이동이 엇갈려 동시에 실행돼도 교착 없이 카운터 합이 보존된다")
    void transfer_crossing_noDeadlock() {
        CourseClass classA = createClass(ProgramTrack.CHURCH, 10);
        CourseClass classB = createClass(ProgramTrack.CHURCH, 10);
        List<Callable<EnrollmentResponse>> tasks = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Long inA = createStudent().getId();
            Long enrollmentInA = transferOrchestrator.register(inA, classA.getId(), false).id();
            tasks.add(() -> transferOrchestrator.transferSameTrack(inA, enrollmentInA, classB.getId(), null));

            Long inB = createStudent().getId();
            Long enrollmentInB = transferOrchestrator.register(inB, classB.getId(), false).id();
            tasks.add(() -> transferOrchestrator.transferSameTrack(inB, enrollmentInB, classA.getId(), null));
        }

        Outcome<EnrollmentResponse> outcome = ConcurrencyTestHelper.runConcurrently(
            tasks, START_TIMEOUT, DONE_TIMEOUT);
        outcome.logUnexpected(log);

        assertThat(outcome.unexpected()).isEmpty();
        assertThat(outcome.successes()).hasSize(10);
        CourseClass reloadedA = courseClassRepository.findById(classA.getId()).orElseThrow();
        CourseClass reloadedB = courseClassRepository.findById(classB.getId()).orElseThrow();
        assertThat(reloadedA.getEnrolledCount()).isEqualTo(5);
        assertThat(reloadedB.getEnrolledCount()).isEqualTo(5);
        assertThat(enrollmentRepository.countByClassIdAndStatus(classA.getId(), EnrollmentStatus.ACTIVE)).isEqualTo(5);
        assertThat(enrollmentRepository.countByClassIdAndStatus(classB.getId(), EnrollmentStatus.ACTIVE)).isEqualTo(5);
    }

    private CourseClass createClass(ProgramTrack track, int capacity) {
        return courseClassRepository.save(CourseClass.open(track, ClassFormat.ONLINE, capacity, false,
            "Seoul", "월 20:00", LocalDateTime.now().plusDays(10), null));
    }

    private Student createStudent() {
        int seq = PHONE_SEQ.incrementAndGet();
        return studentRepository.save(Student.create("동시성" + seq, "010-5000-" + seq, null, Gender.FEMALE));
    }
}
