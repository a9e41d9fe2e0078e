package io.heygw44.cohort.domain.notification.service;

import io.heygw44.cohort.domain.enrollment.event.EnrollmentMovedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 커밋된 반 이동에 대해서만 알림을 보낸다. 알림 실패는 수강 처리 결과에 영향을 주지 않는다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EnrollmentNotificationListener {

    private final TransferNotifier transferNotifier;

    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onEnrollmentMoved(EnrollmentMovedEvent event) {
        try {
            transferNotifier.notifyTransfer(event.studentId(), event.oldClass(), event.newClass());
        } catch (RuntimeException ex) {
            log.warn("반 이동 알림 실패: studentId={}, newEnrollmentId={}, moveType={}",
                event.studentId(), event.newEnrollmentId(), event.moveType(), ex);
        }
    }
}
