package io.heygw44.cohort.domain.enrollment.dto;

import io.heygw44.cohort.global.exception.BusinessException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 수강 자격 검증 결과
 * @param conflictingEnrollmentId ALREADY_ACTIVE_IN_TRACK일 때 충돌한 수강 ID
 * @param referenceAt 수료일(ALREADY_COMPLETED_TRACK) 또는 취소일(REQUIRES_CONFIRMATION)
 */
public record EligibilityResult(
    boolean eligible,
    EligibilityReason reason,
    EligibilityWarning warning,
    Long conflictingEnrollmentId,
    LocalDateTime referenceAt
) {

    public static EligibilityResult ok() {
        return new EligibilityResult(true, null, null, null, null);
    }

    public static EligibilityResult requiresConfirmation(LocalDateTime cancelledAt) {
        return new EligibilityResult(true, null, EligibilityWarning.REQUIRES_CONFIRMATION, null, cancelledAt);
    }

    public static EligibilityResult rejected(EligibilityReason reason) {
        return new EligibilityResult(false, reason, null, null, null);
    }

    public static EligibilityResult activeConflict(Long enrollmentId) {
        return new EligibilityResult(false, EligibilityReason.ALREADY_ACTIVE_IN_TRACK, null, enrollmentId, null);
    }

    public static EligibilityResult completed(LocalDateTime completedAt) {
        return new EligibilityResult(false, EligibilityReason.ALREADY_COMPLETED_TRACK, null, null, completedAt);
    }

    public boolean requiresConfirmation() {
        return warning == EligibilityWarning.REQUIRES_CONFIRMATION;
    }

    /**
     * 오류 응답 details에 실을 값. 충돌 수강 ID와 수료일/취소일만 담는다.
     */
    public Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        if (conflictingEnrollmentId != null) {
            details.put("conflictingEnrollmentId", conflictingEnrollmentId);
        }
        if (referenceAt != null) {
            details.put(requiresConfirmation() ? "cancelledAt" : "completedAt", referenceAt);
        }
        return details;
    }

    /**
     * 불가 사유를 ErrorCode로 변환해 던진다. 수강 가능하면 아무것도 하지 않는다.
     */
    public void throwIfRejected() {
        if (!eligible) {
            throw new BusinessException(reason.getErrorCode(), details());
        }
    }
}
