package io.heygw44.cohort.domain.courseclass.service;

import io.heygw44.cohort.domain.courseclass.dto.CapacitySnapshot;
import io.heygw44.cohort.domain.courseclass.entity.ClassFormat;
import io.heygw44.cohort.domain.courseclass.entity.CourseClass;
import io.heygw44.cohort.domain.courseclass.entity.ProgramTrack;
import io.heygw44.cohort.domain.courseclass.repository.CourseClassRepository;
import io.heygw44.cohort.domain.enrollment.repository.EnrollmentRepository;
import io.heygw44.cohort.global.exception.BusinessException;
import io.heygw44.cohort.global.exception.EnrollmentInvariantException;
import io.heygw44.cohort.global.exception.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("local")
@DisplayName("CapacityLedger 통합 테스트")
class PessimisticCapacityLedgerTest {

    @Autowired
    private CapacityLedger capacityLedger;

    @Autowired
    private CourseClassRepository courseClassRepository;

    @Autowired
    private EnrollmentRepository enrollmentRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private TransactionTemplate tx;

    @BeforeEach
    void setUp() {
        tx = new TransactionTemplate(transactionManager);
    }

    @AfterEach
    void tearDown() {
        enrollmentRepository.deleteAll();
        courseClassRepository.deleteAll();
    }

    @Test
    @DisplayName("트랜잭션 밖에서 좌석 점유 시도 → 거부")
    void reserve_withoutTransaction_rejected() {
        CourseClass courseClass = createClass(3);

        assertThatThrownBy(() -> capacityLedger.reserve(courseClass.getId()))
            .isInstanceOf(IllegalTransactionStateException.class);
        assertThat(enrolledCount(courseClass)).isZero();
    }

    @Test
    @DisplayName("정원까지 점유 후 추가 점유 → CLASS_FULL, 카운터 유지")
    void reserve_untilFull_thenRejected() {
        CourseClass courseClass = createClass(2);

        tx.executeWithoutResult(status -> capacityLedger.reserve(courseClass.getId()));
        tx.executeWithoutResult(status -> capacityLedger.reserve(courseClass.getId()));

        assertThatThrownBy(() -> tx.executeWithoutResult(status -> capacityLedger.reserve(courseClass.getId())))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.CLASS_FULL);
        assertThat(enrolledCount(courseClass)).isEqualTo(2);
    }

    @Test
    @DisplayName("비활성 반 점유 → CLASS_INACTIVE")
    void reserve_inactiveClass_rejected() {
        CourseClass courseClass = createClass(5);
        courseClass.deactivate();
        courseClassRepository.save(courseClass);

        assertThatThrownBy(() -> tx.executeWithoutResult(status -> capacityLedger.reserve(courseClass.getId())))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.CLASS_INACTIVE);
    }

    @Test
    @DisplayName("존재하지 않는 반 → CLASS_NOT_FOUND")
    void reserve_unknownClass_notFound() {
        assertThatThrownBy(() -> tx.executeWithoutResult(status -> capacityLedger.reserve(999_999L)))
            .isInstanceOf(BusinessException.class)
            .extracting("errorCode")
            .isEqualTo(ErrorCode.CLASS_NOT_FOUND);
    }

    @Test
    @DisplayName("점유된 좌석 없이 반납 → 불변식 위반, 카운터는 0 유지")
    void release_belowZero_invariantViolation() {
        CourseClass courseClass = createClass(5);

        assertThatThrownBy(() -> tx.executeWithoutResult(status -> capacityLedger.release(courseClass.getId())))
            .isInstanceOf(EnrollmentInvariantException.class);
        assertThat(enrolledCount(courseClass)).isZero();
    }

    @Test
    @DisplayName("트랜잭션이 롤백되면 점유한 좌석도 되돌아간다")
    void reserve_rolledBack_restoresCounter() {
        CourseClass courseClass = createClass(5);

        tx.executeWithoutResult(status -> {
            capacityLedger.reserve(courseClass.getId());
            status.setRollbackOnly();
        });

        assertThat(enrolledCount(courseClass)).isZero();
    }

    @Test
    @DisplayName("ACTIVE 수강 없이 카운터만 올라가면 스냅샷이 불일치로 표시된다")
    void snapshot_detectsDrift() {
        CourseClass courseClass = createClass(5);
        tx.executeWithoutResult(status -> capacityLedger.reserve(courseClass.getId()));

        CapacitySnapshot snapshot = capacityLedger.snapshot(courseClass.getId());

        assertThat(snapshot.capacity()).isEqualTo(5);
        assertThat(snapshot.enrolledCount()).isEqualTo(1);
        assertThat(snapshot.activeEnrollmentCount()).isZero();
        assertThat(snapshot.availableSeats()).isEqualTo(4);
        assertThat(snapshot.consistent()).isFalse();
    }

    @Test
    @DisplayName("새로 만든 반의 스냅샷은 일치 상태")
    void snapshot_emptyClass_consistent() {
        CourseClass courseClass = createClass(5);

        CapacitySnapshot snapshot = capacityLedger.snapshot(courseClass.getId());

        assertThat(snapshot.consistent()).isTrue();
        assertThat(snapshot.availableSeats()).isEqualTo(5);
    }

    private CourseClass createClass(int capacity) {
        return courseClassRepository.save(CourseClass.open(ProgramTrack.CHURCH, ClassFormat.ONLINE, capacity, false,
            "Seoul", "수 19:00", LocalDateTime.now().plusDays(5), null));
    }

    private int enrolledCount(CourseClass courseClass) {
        return courseClassRepository.findById(courseClass.getId()).orElseThrow().getEnrolledCount();
    }
}
