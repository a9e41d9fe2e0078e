package io.heygw44.cohort.domain.courseclass.controller;

import io.heygw44.cohort.domain.courseclass.dto.CapacitySnapshot;
import io.heygw44.cohort.domain.enrollment.dto.RosterResponse;
import io.heygw44.cohort.domain.enrollment.service.EnrollmentQueryService;
import io.heygw44.cohort.global.response.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 운영자용 반 조회 API
 */
@RestController
@RequestMapping("/api/admin/classes/{classId}")
@RequiredArgsConstructor
public class ClassAdminController {

    private final EnrollmentQueryService enrollmentQueryService;

    @GetMapping("/enrollments")
    public ResponseEntity<ApiResponse<RosterResponse>> getRoster(@PathVariable Long classId) {
        return ResponseEntity.ok(ApiResponse.success(enrollmentQueryService.getClassRoster(classId)));
    }

    @GetMapping("/capacity")
    public ResponseEntity<ApiResponse<CapacitySnapshot>> getCapacity(@PathVariable Long classId) {
        return ResponseEntity.ok(ApiResponse.success(enrollmentQueryService.getCapacity(classId)));
    }
}
