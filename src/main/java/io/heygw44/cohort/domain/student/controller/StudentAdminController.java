package io.heygw44.cohort.domain.student.controller;

import io.heygw44.cohort.domain.enrollment.dto.EnrollmentResponse;
import io.heygw44.cohort.domain.enrollment.service.TransferOrchestrator;
import io.heygw44.cohort.domain.student.dto.PriorityListRequest;
import io.heygw44.cohort.domain.student.dto.PriorityListResponse;
import io.heygw44.cohort.domain.student.service.PriorityListService;
import io.heygw44.cohort.global.response.ApiResponse;
import io.heygw44.cohort.global.security.CustomUserDetails;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * 운영자용 우선 대기 명단 API
 */
@RestController
@RequestMapping("/api/admin/students/{studentId}/priority-list")
@RequiredArgsConstructor
public class StudentAdminController {

    private final TransferOrchestrator transferOrchestrator;
    private final PriorityListService priorityListService;

    /**
     * 대기 명단 참여자를 반에 등록하고 대기 표시 해제
     * POST /api/admin/students/{studentId}/priority-list/enroll
     */
    @PostMapping("/enroll")
    public ResponseEntity<ApiResponse<EnrollmentResponse>> enroll(
            @PathVariable Long studentId,
            @Valid @RequestBody PriorityListRequest request,
            @AuthenticationPrincipal CustomUserDetails userDetails) {

        EnrollmentResponse response = transferOrchestrator.enrollFromPriorityList(
            studentId, request.classId(), userDetails.getAdminId());

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApiResponse.success(response));
    }

    /**
     * 대기 명단 해제
     * DELETE /api/admin/students/{studentId}/priority-list
     */
    @DeleteMapping
    public ResponseEntity<ApiResponse<PriorityListResponse>> remove(
            @PathVariable Long studentId,
            @AuthenticationPrincipal CustomUserDetails userDetails) {

        PriorityListResponse response = priorityListService.removeFromPriorityList(
            studentId, userDetails.getAdminId());
        return ResponseEntity.ok(ApiResponse.success(response));
    }
}
