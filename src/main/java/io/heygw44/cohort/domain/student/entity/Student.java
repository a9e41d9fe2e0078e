package io.heygw44.cohort.domain.student.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 참여자 엔티티
 * 우선 대기 명단 표시(priorityListed)는 ACTIVE 수강과 동시에 가질 수 없다.
 */
@Entity
@Table(name = "student", indexes = {
    @Index(name = "idx_student_priority_list", columnList = "priority_listed")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Student {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, unique = true, length = 20)
    private String phone;

    @Column(length = 255)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Gender gender;

    @Column(name = "priority_listed", nullable = false)
    private boolean priorityListed;

    @Column(name = "priority_class_id")
    private Long priorityClassId;

    @Column(name = "priority_listed_at")
    private LocalDateTime priorityListedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    private Student(String name, String phone, String email, Gender gender) {
        this.name = name;
        this.phone = phone;
        this.email = email;
        this.gender = gender == null ? Gender.UNDISCLOSED : gender;
        this.priorityListed = false;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 참여자 생성 팩토리 메서드 (프로필 관리는 외부 책임, 시드/테스트 용도)
     */
    public static Student create(String name, String phone, String email, Gender gender) {
        return new Student(name, phone, email, gender);
    }

    /**
     * 우선 대기 명단 등록 (이미 등록돼 있으면 반/시각 갱신)
     */
    public void markPriority(Long classId) {
        this.priorityListed = true;
        this.priorityClassId = classId;
        this.priorityListedAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    public void clearPriority() {
        this.priorityListed = false;
        this.priorityClassId = null;
        this.priorityListedAt = null;
        this.updatedAt = LocalDateTime.now();
    }
}
