package io.heygw44.cohort.domain.courseclass.dto;

import io.heygw44.cohort.domain.courseclass.entity.ProgramTrack;

import java.util.List;

/**
 * 참여자별 신청 가능 반 목록 (과정별 묶음)
 */
public record AvailableClassesResponse(
    Long studentId,
    List<TrackClasses> tracks
) {

    public record TrackClasses(
        ProgramTrack track,
        List<CourseClassResponse> classes
    ) {
    }
}
