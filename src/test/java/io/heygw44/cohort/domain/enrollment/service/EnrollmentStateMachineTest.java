package io.heygw44.cohort.domain.enrollment.service;

import io.heygw44.cohort.domain.courseclass.entity.ProgramTrack;
import io.heygw44.cohort.domain.courseclass.repository.CourseClassRepository;
import io.heygw44.cohort.domain.courseclass.service.CapacityLedger;
import io.heygw44.cohort.domain.enrollment.entity.Enrollment;
import io.heygw44.cohort.domain.enrollment.entity.EnrollmentStatus;
import io.heygw44.cohort.domain.enrollment.repository.EnrollmentRepository;
import io.heygw44.cohort.global.exception.BusinessException;
import io.heygw44.cohort.global.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static io.heygw44.cohort.support.TestFixtures.courseClass;
import static io.heygw44.cohort.support.TestFixtures.enrollment;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("EnrollmentStateMachine 테스트")
class EnrollmentStateMachineTest {

    private static final Long STUDENT_ID = 1L;
    private static final Long CLASS_ID = 10L;

    @Mock
    private EnrollmentRepository enrollmentRepository;

    @Mock
    private CourseClassRepository courseClassRepository;

    @Mock
    private CapacityLedger capacityLedger;

    @InjectMocks
    private EnrollmentStateMachine enrollmentStateMachine;

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("이력이 없으면 ACTIVE 행을 새로 저장")
        void create_newRow() {
            given(courseClassRepository.findById(CLASS_ID))
                .willReturn(Optional.of(courseClass(CLASS_ID, ProgramTrack.CHURCH, 10)));
            given(enrollmentRepository.findByStudentIdAndClassId(STUDENT_ID, CLASS_ID)).willReturn(Optional.empty());
            given(enrollmentRepository.findHistoryInTrack(STUDENT_ID, ProgramTrack.CHURCH)).willReturn(List.of());
            given(enrollmentRepository.saveAndFlush(any(Enrollment.class)))
                .willAnswer(invocation -> invocation.getArgument(0));

            Enrollment created = enrollmentStateMachine.create(STUDENT_ID, CLASS_ID, null);

            assertThat(created.getStatus()).isEqualTo(EnrollmentStatus.ACTIVE);
            assertThat(created.getClassId()).isEqualTo(CLASS_ID);
        }

        @Test
        @DisplayName("같은 과정에 ACTIVE가 있으면 ENROLL-409-ACTIVE")
        void create_activeInTrack_fails() {
            given(courseClassRepository.findById(CLASS_ID))
                .willReturn(Optional.of(courseClass(CLASS_ID, ProgramTrack.CHURCH, 10)));
            given(enrollmentRepository.findByStudentIdAndClassId(STUDENT_ID, CLASS_ID)).willReturn(Optional.empty());
            given(enrollmentRepository.findHistoryInTrack(STUDENT_ID, ProgramTrack.CHURCH))
                .willReturn(List.of(enrollment(5L, STUDENT_ID, 11L)));

            assertThatThrownBy(() -> enrollmentStateMachine.create(STUDENT_ID, CLASS_ID, null))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode")
                .isEqualTo(ErrorCode.ALREADY_ACTIVE_IN_TRACK);
            verify(enrollmentRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("같은 반 취소 행은 새로 만들지 않고 다시 연다")
        void create_reopensCancelledRow() {
            Enrollment cancelled = enrollment(5L, STUDENT_ID, CLASS_ID);
            cancelled.cancel();
            given(courseClassRepository.findById(CLASS_ID))
                .willReturn(Optional.of(courseClass(CLASS_ID, ProgramTrack.CHURCH, 10)));
            given(enrollmentRepository.findByStudentIdAndClassId(STUDENT_ID, CLASS_ID))
                .willReturn(Optional.of(cancelled));
            given(enrollmentRepository.findHistoryInTrack(STUDENT_ID, ProgramTrack.CHURCH))
                .willReturn(List.of(cancelled));

            Enrollment reopened = enrollmentStateMachine.create(STUDENT_ID, CLASS_ID, 7L);

            assertThat(reopened.getId()).isEqualTo(5L);
            assertThat(reopened.getStatus()).isEqualTo(EnrollmentStatus.ACTIVE);
            assertThat(reopened.getTransferredFromClassId()).isEqualTo(7L);
            assertThat(reopened.getCancelledAt()).isNull();
            verify(enrollmentRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("같은 반 수료 행이면 ENROLL-409-COMPLETED")
        void create_completedRow_fails() {
            Enrollment completed = enrollment(5L, STUDENT_ID, CLASS_ID);
            completed.complete();
            given(courseClassRepository.findById(CLASS_ID))
                .willReturn(Optional.of(courseClass(CLASS_ID, ProgramTrack.CHURCH, 10)));
            given(enrollmentRepository.findByStudentIdAndClassId(STUDENT_ID, CLASS_ID))
                .willReturn(Optional.of(completed));
            given(enrollmentRepository.findHistoryInTrack(STUDENT_ID, ProgramTrack.CHURCH))
                .willReturn(List.of(completed));

            assertThatThrownBy(() -> enrollmentStateMachine.create(STUDENT_ID, CLASS_ID, null))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.ALREADY_COMPLETED_TRACK);
        }

        @Test
        @DisplayName("같은 반 ACTIVE 행은 그대로 반환")
        void create_activeRow_idempotent() {
            Enrollment active = enrollment(5L, STUDENT_ID, CLASS_ID);
            given(courseClassRepository.findById(CLASS_ID))
                .willReturn(Optional.of(courseClass(CLASS_ID, ProgramTrack.CHURCH, 10)));
            given(enrollmentRepository.findByStudentIdAndClassId(STUDENT_ID, CLASS_ID))
                .willReturn(Optional.of(active));

            assertThat(enrollmentStateMachine.create(STUDENT_ID, CLASS_ID, null)).isSameAs(active);
            verify(enrollmentRepository, never()).findHistoryInTrack(any(), any());
        }
    }

    @Nested
    @DisplayName("complete")
    class Complete {

        @Test
        @DisplayName("ACTIVE 수강을 수료 처리하고 좌석 반납")
        void complete_active_releasesSeat() {
            Enrollment active = enrollment(5L, STUDENT_ID, CLASS_ID);
            given(enrollmentRepository.findByIdForUpdate(5L)).willReturn(Optional.of(active));

            Enrollment result = enrollmentStateMachine.complete(5L);

            assertThat(result.getStatus()).isEqualTo(EnrollmentStatus.COMPLETED);
            verify(capacityLedger).release(CLASS_ID);
        }

        @Test
        @DisplayName("이미 수료한 수강은 아무것도 하지 않고 성공")
        void complete_twice_noOp() {
            Enrollment completed = enrollment(5L, STUDENT_ID, CLASS_ID);
            completed.complete();
            given(enrollmentRepository.findByIdForUpdate(5L)).willReturn(Optional.of(completed));

            Enrollment result = enrollmentStateMachine.complete(5L);

            assertThat(result.getStatus()).isEqualTo(EnrollmentStatus.COMPLETED);
            verifyNoInteractions(capacityLedger);
        }

        @Test
        @DisplayName("취소된 수강 수료 처리는 ENROLL-409-STATE, 좌석 변화 없음")
        void complete_cancelled_fails() {
            Enrollment cancelled = enrollment(5L, STUDENT_ID, CLASS_ID);
            cancelled.cancel();
            given(enrollmentRepository.findByIdForUpdate(5L)).willReturn(Optional.of(cancelled));

            assertThatThrownBy(() -> enrollmentStateMachine.complete(5L))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.INVALID_TRANSITION);
            verifyNoInteractions(capacityLedger);
        }

        @Test
        @DisplayName("없는 수강은 ENROLL-404")
        void complete_missing_fails() {
            given(enrollmentRepository.findByIdForUpdate(anyLong())).willReturn(Optional.empty());

            assertThatThrownBy(() -> enrollmentStateMachine.complete(99L))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.ENROLLMENT_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("cancel / markTransferred")
    class CancelAndTransfer {

        @Test
        @DisplayName("취소는 좌석을 반납한다")
        void cancel_releasesSeat() {
            Enrollment active = enrollment(5L, STUDENT_ID, CLASS_ID);
            given(enrollmentRepository.findByIdForUpdate(5L)).willReturn(Optional.of(active));

            enrollmentStateMachine.cancel(5L);

            assertThat(active.getStatus()).isEqualTo(EnrollmentStatus.CANCELLED);
            verify(capacityLedger).release(CLASS_ID);
        }

        @Test
        @DisplayName("이미 취소된 수강 취소는 ENROLL-409-STATE")
        void cancel_twice_fails() {
            Enrollment cancelled = enrollment(5L, STUDENT_ID, CLASS_ID);
            cancelled.cancel();
            given(enrollmentRepository.findByIdForUpdate(5L)).willReturn(Optional.of(cancelled));

            assertThatThrownBy(() -> enrollmentStateMachine.cancel(5L))
                .extracting("errorCode")
                .isEqualTo(ErrorCode.INVALID_TRANSITION);
            verifyNoInteractions(capacityLedger);
        }

        @Test
        @DisplayName("이동 처리는 좌석을 반납하지 않는다")
        void markTransferred_keepsSeat() {
            Enrollment active = enrollment(5L, STUDENT_ID, CLASS_ID);
            given(enrollmentRepository.findByIdForUpdate(5L)).willReturn(Optional.of(active));

            enrollmentStateMachine.markTransferred(5L);

            assertThat(active.getStatus()).isEqualTo(EnrollmentStatus.TRANSFERRED);
            verifyNoInteractions(capacityLedger);
        }
    }
}
