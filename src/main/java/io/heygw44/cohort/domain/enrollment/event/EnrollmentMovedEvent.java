package io.heygw44.cohort.domain.enrollment.event;

/**
 * 반 이동/과정 변경 완료 이벤트 (커밋 후 알림 발송용)
 * @param actorId 운영자가 처리한 경우 운영자 ID, 참여자 본인 요청이면 null
 */
public record EnrollmentMovedEvent(
    Long studentId,
    Long newEnrollmentId,
    MoveType moveType,
    ClassSummary oldClass,
    ClassSummary newClass,
    Long actorId
) {
}
