package io.heygw44.cohort.domain.enrollment.entity;

import io.heygw44.cohort.global.exception.BusinessException;
import io.heygw44.cohort.global.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 수강 등록 엔티티
 * (student_id, class_id) 조합당 한 행만 존재하며, 재등록은 기존 행을 다시 연다.
 */
@Entity
@Table(name = "enrollment",
       uniqueConstraints = @UniqueConstraint(
           name = "uk_enrollment_student_class",
           columnNames = {"student_id", "class_id"}
       ),
       indexes = {
           @Index(name = "idx_enrollment_class_status", columnList = "class_id, status"),
           @Index(name = "idx_enrollment_student_status", columnList = "student_id, status")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Enrollment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Column(name = "class_id", nullable = false)
    private Long classId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EnrollmentStatus status;

    @Column(name = "transferred_from_class_id")
    private Long transferredFromClassId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    private Enrollment(Long studentId, Long classId, Long transferredFromClassId) {
        this.studentId = studentId;
        this.classId = classId;
        this.transferredFromClassId = transferredFromClassId;
        this.status = EnrollmentStatus.ACTIVE;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 수강 등록 팩토리 메서드 (ACTIVE로 생성)
     * @param transferredFromClassId 이동으로 생성된 경우 이전 반, 아니면 null
     */
    public static Enrollment open(Long studentId, Long classId, Long transferredFromClassId) {
        return new Enrollment(studentId, classId, transferredFromClassId);
    }

    private void transitionTo(EnrollmentStatus newStatus) {
        if (!this.status.canTransitionTo(newStatus)) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                "enrollmentId=" + id + ", " + status + " -> " + newStatus);
        }
        this.status = newStatus;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 수료 (ACTIVE → COMPLETED)
     */
    public void complete() {
        transitionTo(EnrollmentStatus.COMPLETED);
        this.completedAt = this.updatedAt;
    }

    /**
     * 취소 (ACTIVE → CANCELLED)
     */
    public void cancel() {
        transitionTo(EnrollmentStatus.CANCELLED);
        this.cancelledAt = this.updatedAt;
    }

    /**
     * 이동 처리 (ACTIVE → TRANSFERRED)
     */
    public void markTransferred() {
        transitionTo(EnrollmentStatus.TRANSFERRED);
    }

    /**
     * 취소/이동된 행을 다시 ACTIVE로 연다.
     * 유니크 제약상 같은 반 재등록은 새 행을 만들 수 없어 이 경로만 ACTIVE로 되돌린다.
     */
    public void reopen(Long transferredFromClassId) {
        if (!this.status.isReopenable()) {
            throw new BusinessException(ErrorCode.INVALID_TRANSITION,
                "enrollmentId=" + id + ", " + status + " -> " + EnrollmentStatus.ACTIVE);
        }
        this.status = EnrollmentStatus.ACTIVE;
        this.transferredFromClassId = transferredFromClassId;
        this.completedAt = null;
        this.cancelledAt = null;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isStatus(EnrollmentStatus status) {
        return this.status == status;
    }

    public boolean isActive() {
        return this.status == EnrollmentStatus.ACTIVE;
    }

    public boolean belongsToStudent(Long studentId) {
        return this.studentId.equals(studentId);
    }

    public boolean isInClass(Long classId) {
        return this.classId.equals(classId);
    }
}
