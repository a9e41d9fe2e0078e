package io.heygw44.cohort.domain.enrollment.dto;

public enum EligibilityWarning {
    REQUIRES_CONFIRMATION  // 같은 과정에 취소 이력만 있음, 재등록 확인 필요
}
