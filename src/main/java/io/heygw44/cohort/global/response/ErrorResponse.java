package io.heygw44.cohort.global.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.heygw44.cohort.global.exception.ErrorCode;
import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public record ErrorResponse(
        String code,
        String message,
        String traceId,
        List<FieldError> fieldErrors,
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        Map<String, Object> details
) {
    public static ErrorResponse from(ErrorCode errorCode) {
        return of(errorCode, Collections.emptyMap());
    }

    /**
     * 거부 사유의 부가 정보(충돌 수강 ID, 기준 일시 등)를 함께 내려준다.
     */
    public static ErrorResponse of(ErrorCode errorCode, Map<String, Object> details) {
        return new ErrorResponse(
                errorCode.getCode(),
                errorCode.getMessage(),
                currentTraceId(),
                Collections.emptyList(),
                details
        );
    }

    public static ErrorResponse validation(List<FieldError> fieldErrors) {
        return new ErrorResponse(
                ErrorCode.VALIDATION_ERROR.getCode(),
                ErrorCode.VALIDATION_ERROR.getMessage(),
                currentTraceId(),
                fieldErrors,
                Collections.emptyMap()
        );
    }

    public static ErrorResponse internal() {
        return from(ErrorCode.INTERNAL_ERROR);
    }

    private static String currentTraceId() {
        return MDC.get("traceId");
    }
}
