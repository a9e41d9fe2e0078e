package io.heygw44.cohort.domain.enrollment.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * 락 충돌 재시도를 WARN으로 남긴다.
 */
@Component("lockConflictRetryListener")
@Slf4j
public class LockConflictRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context,
                                                 RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("락 충돌로 재시도: attempt={}, method={}, cause={}",
            context.getRetryCount(), context.getAttribute(RetryContext.NAME),
            throwable.getClass().getSimpleName());
    }
}
