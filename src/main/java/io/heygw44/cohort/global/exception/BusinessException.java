package io.heygw44.cohort.global.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * 도메인 규칙 위반을 ErrorCode와 함께 전달하는 예외
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
        this.details = Collections.emptyMap();
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(errorCode.getMessage() + " (" + detail + ")");
        this.errorCode = errorCode;
        this.details = Collections.emptyMap();
    }

    /**
     * 응답 본문 details로 내려갈 부가 정보와 함께 생성
     */
    public BusinessException(ErrorCode errorCode, Map<String, Object> details) {
        super(details.isEmpty() ? errorCode.getMessage() : errorCode.getMessage() + " " + details);
        this.errorCode = errorCode;
        this.details = Collections.unmodifiableMap(details);
    }
}
