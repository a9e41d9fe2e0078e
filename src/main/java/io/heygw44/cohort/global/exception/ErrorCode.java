package io.heygw44.cohort.global.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    // Common
    AUTH_UNAUTHORIZED("AUTH-401", "인증이 필요합니다", HttpStatus.UNAUTHORIZED),
    AUTH_FORBIDDEN("AUTH-403", "권한이 없습니다", HttpStatus.FORBIDDEN),
    VALIDATION_ERROR("REQ-400", "입력값이 올바르지 않습니다", HttpStatus.BAD_REQUEST),
    RESOURCE_NOT_FOUND("RES-404", "리소스를 찾을 수 없습니다", HttpStatus.NOT_FOUND),
    CONCURRENT_CONFLICT("REQ-409-BUSY", "요청이 몰려 처리하지 못했습니다. 잠시 후 다시 시도해주세요", HttpStatus.CONFLICT),

    // Auth
    INVALID_CREDENTIALS("AUTH-401-CREDENTIALS", "이메일 또는 비밀번호가 올바르지 않습니다", HttpStatus.UNAUTHORIZED),
    SESSION_LIMIT_EXCEEDED("AUTH-409-SESSION", "동시 접속 가능한 세션 수를 초과했습니다", HttpStatus.CONFLICT),

    // Student
    STUDENT_NOT_FOUND("STUDENT-404", "참여자를 찾을 수 없습니다", HttpStatus.NOT_FOUND),

    // Class
    CLASS_NOT_FOUND("CLASS-404", "반을 찾을 수 없습니다", HttpStatus.NOT_FOUND),
    CLASS_INACTIVE("CLASS-409-INACTIVE", "운영 중인 반이 아닙니다", HttpStatus.CONFLICT),
    CLASS_FULL("CLASS-409-FULL", "정원이 가득 찼습니다", HttpStatus.CONFLICT),
    GENDER_RESTRICTED("CLASS-409-GENDER", "여성 전용 반입니다", HttpStatus.CONFLICT),

    // Enrollment
    ENROLLMENT_NOT_FOUND("ENROLL-404", "수강 등록 정보를 찾을 수 없습니다", HttpStatus.NOT_FOUND),
    ALREADY_ACTIVE_IN_TRACK("ENROLL-409-ACTIVE", "같은 과정에 이미 수강 중인 반이 있습니다", HttpStatus.CONFLICT),
    ALREADY_COMPLETED_TRACK("ENROLL-409-COMPLETED", "이미 수료한 과정입니다", HttpStatus.CONFLICT),
    REENROLLMENT_CONFIRMATION_REQUIRED("ENROLL-409-CONFIRM", "이전 등록이 취소된 이력이 있습니다. 재등록을 확인해주세요", HttpStatus.CONFLICT),
    ALREADY_SAME_CLASS("ENROLL-400-SAME-CLASS", "이미 해당 반에 등록되어 있습니다", HttpStatus.BAD_REQUEST),
    ENROLLMENT_NOT_OWNED("ENROLL-403-OWNER", "본인의 수강 등록이 아닙니다", HttpStatus.FORBIDDEN),
    TRACK_MISMATCH("ENROLL-400-TRACK", "요청한 이동 방식과 과정이 맞지 않습니다", HttpStatus.BAD_REQUEST),
    INVALID_TRANSITION("ENROLL-409-STATE", "허용되지 않는 수강 상태입니다", HttpStatus.CONFLICT),

    // Priority list
    ALREADY_ACTIVELY_ENROLLED("PRIORITY-409-ENROLLED", "수강 중인 반이 있어 우선 대기 명단에 등록할 수 없습니다", HttpStatus.CONFLICT),
    PRIORITY_LIST_NOT_MARKED("PRIORITY-400-NOT-LISTED", "우선 대기 명단에 없는 참여자입니다", HttpStatus.BAD_REQUEST),

    INTERNAL_ERROR("SYS-500", "서버 오류가 발생했습니다", HttpStatus.INTERNAL_SERVER_ERROR);

    private final String code;
    private final String message;
    private final HttpStatus httpStatus;

    ErrorCode(String code, String message, HttpStatus httpStatus) {
        this.code = code;
        this.message = message;
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
