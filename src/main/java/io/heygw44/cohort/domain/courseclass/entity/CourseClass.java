package io.heygw44.cohort.domain.courseclass.entity;

import io.heygw44.cohort.domain.student.entity.Gender;
import io.heygw44.cohort.global.exception.BusinessException;
import io.heygw44.cohort.global.exception.EnrollmentInvariantException;
import io.heygw44.cohort.global.exception.ErrorCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Check;

import java.time.LocalDateTime;

/**
 * 반(수강 단위) 엔티티
 * enrolledCount는 ACTIVE 수강 건수의 캐시이며 CapacityLedger만 변경한다.
 */
@Entity
@Table(name = "course_class", indexes = {
    @Index(name = "idx_course_class_track_active", columnList = "track, active, archived")
})
@Check(constraints = "enrolled_count >= 0 AND enrolled_count <= capacity")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CourseClass {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ProgramTrack track;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ClassFormat format;

    @Column(nullable = false)
    private Integer capacity;

    @Column(name = "enrolled_count", nullable = false)
    private Integer enrolledCount;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private boolean archived;

    @Column(name = "women_only", nullable = false)
    private boolean womenOnly;

    @Column(length = 100)
    private String city;

    @Column(name = "schedule_text", length = 100)
    private String scheduleText;

    @Column(name = "starts_at")
    private LocalDateTime startsAt;

    @Column(name = "group_chat_link", length = 500)
    private String groupChatLink;

    @Version
    private Integer version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    private CourseClass(ProgramTrack track, ClassFormat format, Integer capacity, boolean womenOnly,
                        String city, String scheduleText, LocalDateTime startsAt, String groupChatLink) {
        if (capacity == null || capacity <= 0) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "capacity must be positive");
        }
        this.track = track;
        this.format = format;
        this.capacity = capacity;
        this.enrolledCount = 0;
        this.active = true;
        this.archived = false;
        this.womenOnly = womenOnly;
        this.city = city;
        this.scheduleText = scheduleText;
        this.startsAt = startsAt;
        this.groupChatLink = groupChatLink;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 반 생성 팩토리 메서드
     * 반 개설/편집은 외부 관리 화면 책임이며, 여기서는 시드와 테스트 용도로만 쓴다.
     */
    public static CourseClass open(ProgramTrack track, ClassFormat format, Integer capacity,
                                   boolean womenOnly, String city, String scheduleText,
                                   LocalDateTime startsAt, String groupChatLink) {
        return new CourseClass(track, format, capacity, womenOnly, city, scheduleText,
                               startsAt, groupChatLink);
    }

    /**
     * 좌석 1개 점유 (CapacityLedger 전용)
     */
    public void reserveSeat() {
        if (!isOpenForEnrollment()) {
            throw new BusinessException(ErrorCode.CLASS_INACTIVE);
        }
        if (!hasVacancy()) {
            throw new BusinessException(ErrorCode.CLASS_FULL);
        }
        this.enrolledCount = this.enrolledCount + 1;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 좌석 1개 반납 (CapacityLedger 전용)
     */
    public void releaseSeat() {
        if (this.enrolledCount <= 0) {
            throw new EnrollmentInvariantException(
                "enrolledCount would drop below zero: classId=" + id);
        }
        this.enrolledCount = this.enrolledCount - 1;
        this.updatedAt = LocalDateTime.now();
    }

    public void deactivate() {
        this.active = false;
        this.updatedAt = LocalDateTime.now();
    }

    public void archive() {
        this.archived = true;
        this.active = false;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 신규 등록을 받을 수 있는 반인지 확인 (운영 중 + 보관되지 않음)
     */
    public boolean isOpenForEnrollment() {
        return active && !archived;
    }

    public boolean hasVacancy() {
        return enrolledCount < capacity;
    }

    public int availableSeats() {
        return capacity - enrolledCount;
    }

    /**
     * 성별 제한 확인. 여성 전용 반은 남성 참여자를 받지 않는다.
     */
    public boolean admits(Gender gender) {
        return !womenOnly || gender != Gender.MALE;
    }

    public boolean isSameTrack(CourseClass other) {
        return this.track == other.track;
    }
}
