package io.heygw44.cohort.domain.enrollment.entity;

/**
 * 수강 상태 enum
 * 상태 전이 규칙:
 * - ACTIVE → COMPLETED / CANCELLED / TRANSFERRED
 * - COMPLETED, CANCELLED, TRANSFERRED → (전이 불가, 종료 상태)
 * 정원은 ACTIVE만 차지한다.
 */
public enum EnrollmentStatus {
    ACTIVE,       // 수강 중
    COMPLETED,    // 수료
    CANCELLED,    // 취소
    TRANSFERRED;  // 같은 과정 다른 반으로 이동됨

    /**
     * 현재 상태에서 대상 상태로 전이 가능한지 검증
     * @param target 전이 대상 상태
     * @return 전이 가능 여부
     */
    public boolean canTransitionTo(EnrollmentStatus target) {
        return switch (this) {
            case ACTIVE -> target == COMPLETED || target == CANCELLED || target == TRANSFERRED;
            case COMPLETED, CANCELLED, TRANSFERRED -> false;
        };
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    /**
     * 같은 (참여자, 반) 행을 다시 ACTIVE로 열 수 있는 상태인지.
     * 수료 이력은 다시 열지 않는다.
     */
    public boolean isReopenable() {
        return this == CANCELLED || this == TRANSFERRED;
    }
}
