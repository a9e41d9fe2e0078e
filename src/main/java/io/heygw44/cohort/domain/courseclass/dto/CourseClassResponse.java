package io.heygw44.cohort.domain.courseclass.dto;

import io.heygw44.cohort.domain.courseclass.entity.ClassFormat;
import io.heygw44.cohort.domain.courseclass.entity.CourseClass;
import io.heygw44.cohort.domain.courseclass.entity.ProgramTrack;

import java.time.LocalDateTime;

/**
 * 반 응답 DTO
 */
public record CourseClassResponse(
    Long id,
    ProgramTrack track,
    ClassFormat format,
    String city,
    String scheduleText,
    LocalDateTime startsAt,
    boolean womenOnly,
    int capacity,
    int enrolledCount,
    int availableSeats
) {
    public static CourseClassResponse from(CourseClass courseClass) {
        return new CourseClassResponse(
            courseClass.getId(),
            courseClass.getTrack(),
            courseClass.getFormat(),
            courseClass.getCity(),
            courseClass.getScheduleText(),
            courseClass.getStartsAt(),
            courseClass.isWomenOnly(),
            courseClass.getCapacity(),
            courseClass.getEnrolledCount(),
            courseClass.availableSeats()
        );
    }
}
