package io.heygw44.cohort.domain.enrollment.event;

import io.heygw44.cohort.domain.courseclass.entity.ClassFormat;
import io.heygw44.cohort.domain.courseclass.entity.CourseClass;
import io.heygw44.cohort.domain.courseclass.entity.ProgramTrack;

import java.time.LocalDateTime;

/**
 * 알림용 반 요약. 커밋 이후 비동기 스레드에서 DB 조회 없이 쓰도록 트랜잭션 안에서 만든다.
 */
public record ClassSummary(
    Long classId,
    ProgramTrack track,
    ClassFormat format,
    String city,
    String scheduleText,
    LocalDateTime startsAt,
    String groupChatLink
) {

    public static ClassSummary from(CourseClass courseClass) {
        return new ClassSummary(
            courseClass.getId(),
            courseClass.getTrack(),
            courseClass.getFormat(),
            courseClass.getCity(),
            courseClass.getScheduleText(),
            courseClass.getStartsAt(),
            courseClass.getGroupChatLink()
        );
    }
}
