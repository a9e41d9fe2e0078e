package io.heygw44.cohort.domain.notification.service;

import io.heygw44.cohort.domain.enrollment.event.ClassSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 기본 알림 구현 - 발송 대신 로그만 남긴다.
 */
@Component
@Slf4j
public class LoggingTransferNotifier implements TransferNotifier {

    @Override
    public void notifyTransfer(Long studentId, ClassSummary oldClass, ClassSummary newClass) {
        log.info("반 이동 알림: studentId={}, from={}({} {}), to={}({} {}), groupChatLink={}",
            studentId,
            oldClass.classId(), oldClass.track(), oldClass.scheduleText(),
            newClass.classId(), newClass.track(), newClass.scheduleText(),
            newClass.groupChatLink());
    }
}
