package io.heygw44.cohort.domain.enrollment.controller;

import io.heygw44.cohort.domain.enrollment.dto.EnrollmentResponse;
import io.heygw44.cohort.domain.enrollment.dto.MoveEnrollmentRequest;
import io.heygw44.cohort.domain.enrollment.service.TransferOrchestrator;
import io.heygw44.cohort.global.response.ApiResponse;
import io.heygw44.cohort.global.security.CustomUserDetails;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * 운영자용 수강 관리 API
 */
@RestController
@RequestMapping("/api/admin/enrollments/{enrollmentId}")
@RequiredArgsConstructor
public class EnrollmentAdminController {

    private final TransferOrchestrator transferOrchestrator;

    /**
     * 수강 취소
     * POST /api/admin/enrollments/{enrollmentId}/cancel
     */
    @PostMapping("/cancel")
    public ResponseEntity<ApiResponse<EnrollmentResponse>> cancel(
            @PathVariable Long enrollmentId,
            @AuthenticationPrincipal CustomUserDetails userDetails) {

        EnrollmentResponse response = transferOrchestrator.cancelEnrollment(enrollmentId, userDetails.getAdminId());
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    /**
     * 수료 처리 (이미 수료면 그대로 성공)
     * POST /api/admin/enrollments/{enrollmentId}/complete
     */
    @PostMapping("/complete")
    public ResponseEntity<ApiResponse<EnrollmentResponse>> complete(
            @PathVariable Long enrollmentId,
            @AuthenticationPrincipal CustomUserDetails userDetails) {

        EnrollmentResponse response = transferOrchestrator.completeEnrollment(enrollmentId, userDetails.getAdminId());
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    /**
     * 반 이동 또는 과정 변경 (운영자 처리)
     * POST /api/admin/enrollments/{enrollmentId}/move
     */
    @PostMapping("/move")
    public ResponseEntity<ApiResponse<EnrollmentResponse>> move(
            @PathVariable Long enrollmentId,
            @Valid @RequestBody MoveEnrollmentRequest request,
            @AuthenticationPrincipal CustomUserDetails userDetails) {

        EnrollmentResponse response = transferOrchestrator.move(
            request.studentId(), enrollmentId, request.newClassId(), userDetails.getAdminId());

        return ResponseEntity.ok(ApiResponse.success(response));
    }
}
