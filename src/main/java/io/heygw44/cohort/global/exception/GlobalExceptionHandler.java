package io.heygw44.cohort.global.exception;

import io.heygw44.cohort.global.response.ErrorResponse;
import io.heygw44.cohort.global.response.FieldError;
import jakarta.persistence.LockTimeoutException;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PessimisticLockException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.web.authentication.session.SessionAuthenticationException;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex) {
        ErrorCode errorCode = ex.getErrorCode();
        return ResponseEntity
                .status(errorCode.getHttpStatus())
                .body(ErrorResponse.of(errorCode, ex.getDetails()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        BindingResult bindingResult = ex.getBindingResult();
        List<FieldError> fieldErrors = bindingResult.getFieldErrors().stream()
                .map(error -> new FieldError(error.getField(), error.getDefaultMessage()))
                .toList();
        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.getHttpStatus())
                .body(ErrorResponse.validation(fieldErrors));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception ex) {
        return ResponseEntity
                .status(ErrorCode.VALIDATION_ERROR.getHttpStatus())
                .body(ErrorResponse.from(ErrorCode.VALIDATION_ERROR));
    }

    @ExceptionHandler(SessionAuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleSessionAuthException(SessionAuthenticationException ex) {
        return ResponseEntity
                .status(ErrorCode.SESSION_LIMIT_EXCEEDED.getHttpStatus())
                .body(ErrorResponse.from(ErrorCode.SESSION_LIMIT_EXCEEDED));
    }

    /**
     * 락 충돌 재시도를 모두 소진한 경우. 잠시 후 다시 시도할 수 있는 409로 응답한다.
     */
    @ExceptionHandler({
            PessimisticLockingFailureException.class,
            OptimisticLockingFailureException.class,
            PessimisticLockException.class,
            LockTimeoutException.class,
            OptimisticLockException.class
    })
    public ResponseEntity<ErrorResponse> handleLockConflict(Exception ex) {
        log.warn("락 충돌 재시도 소진: {}", ex.getClass().getSimpleName());
        return ResponseEntity
                .status(ErrorCode.CONCURRENT_CONFLICT.getHttpStatus())
                .body(ErrorResponse.from(ErrorCode.CONCURRENT_CONFLICT));
    }

    @ExceptionHandler(EnrollmentInvariantException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolation(EnrollmentInvariantException ex) {
        log.error("수강 불변식 위반: {}", ex.getMessage(), ex);
        return ResponseEntity
                .status(ErrorCode.INTERNAL_ERROR.getHttpStatus())
                .body(ErrorResponse.internal());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnhandledException(Exception ex) {
        log.error("처리되지 않은 예외", ex);
        return ResponseEntity
                .status(ErrorCode.INTERNAL_ERROR.getHttpStatus())
                .body(ErrorResponse.internal());
    }
}
