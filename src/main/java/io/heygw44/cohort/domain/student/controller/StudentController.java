package io.heygw44.cohort.domain.student.controller;

import io.heygw44.cohort.domain.courseclass.dto.AvailableClassesResponse;
import io.heygw44.cohort.domain.enrollment.service.EnrollmentQueryService;
import io.heygw44.cohort.domain.student.dto.PriorityListRequest;
import io.heygw44.cohort.domain.student.dto.PriorityListResponse;
import io.heygw44.cohort.domain.student.service.PriorityListService;
import io.heygw44.cohort.global.response.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 참여자용 API (신청 가능 반 조회, 우선 대기 명단 신청)
 */
@RestController
@RequestMapping("/api/students/{studentId}")
@RequiredArgsConstructor
public class StudentController {

    private final EnrollmentQueryService enrollmentQueryService;
    private final PriorityListService priorityListService;

    /**
     * 신청 가능 반 목록
     * GET /api/students/{studentId}/available-classes
     */
    @GetMapping("/available-classes")
    public ResponseEntity<ApiResponse<AvailableClassesResponse>> getAvailableClasses(
            @PathVariable Long studentId) {

        return ResponseEntity.ok(ApiResponse.success(enrollmentQueryService.getAvailableClasses(studentId)));
    }

    /**
     * 우선 대기 명단 신청
     * POST /api/students/{studentId}/priority-list
     */
    @PostMapping("/priority-list")
    public ResponseEntity<ApiResponse<PriorityListResponse>> addToPriorityList(
            @PathVariable Long studentId,
            @Valid @RequestBody PriorityListRequest request) {

        PriorityListResponse response = priorityListService.addToPriorityList(studentId, request.classId());
        return ResponseEntity.ok(ApiResponse.success(response));
    }
}
