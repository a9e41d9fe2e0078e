package io.heygw44.cohort.domain.enrollment.controller;

import io.heygw44.cohort.domain.enrollment.dto.EligibilityResult;
import io.heygw44.cohort.domain.enrollment.dto.EnrollmentResponse;
import io.heygw44.cohort.domain.enrollment.dto.MoveEnrollmentRequest;
import io.heygw44.cohort.domain.enrollment.dto.RegisterEnrollmentRequest;
import io.heygw44.cohort.domain.enrollment.dto.ValidateEnrollmentRequest;
import io.heygw44.cohort.domain.enrollment.service.EligibilityValidator;
import io.heygw44.cohort.domain.enrollment.service.TransferOrchestrator;
import io.heygw44.cohort.global.response.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 참여자용 수강 REST API 컨트롤러
 */
@RestController
@RequestMapping("/api/enrollments")
@RequiredArgsConstructor
public class EnrollmentController {

    private final EligibilityValidator eligibilityValidator;
    private final TransferOrchestrator transferOrchestrator;

    /**
     * 수강 자격 사전 검증 (상태 변경 없음)
     * POST /api/enrollments/validate
     */
    @PostMapping("/validate")
    public ResponseEntity<ApiResponse<EligibilityResult>> validate(
            @Valid @RequestBody ValidateEnrollmentRequest request) {

        EligibilityResult result = eligibilityValidator.validate(request.studentId(), request.classId());
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    /**
     * 수강 등록
     * POST /api/enrollments
     */
    @PostMapping
    public ResponseEntity<ApiResponse<EnrollmentResponse>> register(
            @Valid @RequestBody RegisterEnrollmentRequest request) {

        EnrollmentResponse response = transferOrchestrator.register(
            request.studentId(), request.classId(), request.confirmReEnrollment());

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApiResponse.success(response));
    }

    /**
     * 반 이동 또는 과정 변경 (참여자 본인 요청)
     * POST /api/enrollments/{enrollmentId}/move
     */
    @PostMapping("/{enrollmentId}/move")
    public ResponseEntity<ApiResponse<EnrollmentResponse>> move(
            @PathVariable Long enrollmentId,
            @Valid @RequestBody MoveEnrollmentRequest request) {

        EnrollmentResponse response = transferOrchestrator.move(
            request.studentId(), enrollmentId, request.newClassId(), null);

        return ResponseEntity.ok(ApiResponse.success(response));
    }
}
