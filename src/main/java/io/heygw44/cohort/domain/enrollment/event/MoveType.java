package io.heygw44.cohort.domain.enrollment.event;

public enum MoveType {
    TRANSFER,      // 같은 과정 내 반 이동 (이전 수강은 TRANSFERRED)
    TRACK_CHANGE   // 다른 과정으로 변경 (이전 수강은 CANCELLED)
}
