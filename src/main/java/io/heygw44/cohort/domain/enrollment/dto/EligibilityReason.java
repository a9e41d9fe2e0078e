package io.heygw44.cohort.domain.enrollment.dto;

import io.heygw44.cohort.global.exception.ErrorCode;

/**
 * 수강 불가 사유 (검증 순서대로)
 */
public enum EligibilityReason {
    STUDENT_NOT_FOUND(ErrorCode.STUDENT_NOT_FOUND),
    CLASS_NOT_FOUND(ErrorCode.CLASS_NOT_FOUND),
    CLASS_INACTIVE(ErrorCode.CLASS_INACTIVE),
    GENDER_RESTRICTED(ErrorCode.GENDER_RESTRICTED),
    CLASS_FULL(ErrorCode.CLASS_FULL),
    ALREADY_ACTIVE_IN_TRACK(ErrorCode.ALREADY_ACTIVE_IN_TRACK),
    ALREADY_COMPLETED_TRACK(ErrorCode.ALREADY_COMPLETED_TRACK);

    private final ErrorCode errorCode;

    EligibilityReason(ErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
