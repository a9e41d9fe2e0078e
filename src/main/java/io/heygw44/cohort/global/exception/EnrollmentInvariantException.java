package io.heygw44.cohort.global.exception;

/**
 * 정원 카운터/수강 상태 불변식이 깨졌을 때 발생하는 예외.
 * 사용자 입력 오류가 아니라 프로그래밍 오류이므로 보정하지 않고 트랜잭션을 중단한다.
 */
public class EnrollmentInvariantException extends IllegalStateException {

    public EnrollmentInvariantException(String message) {
        super(message);
    }
}
