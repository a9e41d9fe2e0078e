package io.heygw44.cohort.domain.notification.service;

import io.heygw44.cohort.domain.enrollment.event.ClassSummary;

/**
 * 반 이동 알림 발송 경계. 실제 발송(메신저/웹훅)은 외부 구현이 맡는다.
 */
public interface TransferNotifier {

    void notifyTransfer(Long studentId, ClassSummary oldClass, ClassSummary newClass);
}
