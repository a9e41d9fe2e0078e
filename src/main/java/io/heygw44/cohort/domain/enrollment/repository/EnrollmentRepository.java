package io.heygw44.cohort.domain.enrollment.repository;

import io.heygw44.cohort.domain.courseclass.entity.ProgramTrack;
import io.heygw44.cohort.domain.enrollment.entity.Enrollment;
import io.heygw44.cohort.domain.enrollment.entity.EnrollmentStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface EnrollmentRepository extends JpaRepository<Enrollment, Long> {

    /**
     * 수강 단건 조회 (PESSIMISTIC_WRITE)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000")})
    @Query("SELECT e FROM Enrollment e WHERE e.id = :id")
    Optional<Enrollment> findByIdForUpdate(@Param("id") Long id);

    /**
     * (참여자, 반) 행 조회 - 유니크 제약으로 최대 1건
     */
    Optional<Enrollment> findByStudentIdAndClassId(Long studentId, Long classId);

    /**
     * 과정별 수강 이력 (최근 변경 순)
     */
    @Query("""
        SELECT e FROM Enrollment e
        JOIN CourseClass c ON c.id = e.classId
        WHERE e.studentId = :studentId
        AND c.track = :track
        ORDER BY e.updatedAt DESC, e.id DESC
        """)
    List<Enrollment> findHistoryInTrack(
        @Param("studentId") Long studentId, @Param("track") ProgramTrack track);

    /**
     * 이동 계보 추적: 특정 반에서 넘어온 참여자의 수강
     */
    List<Enrollment> findByStudentIdAndTransferredFromClassId(Long studentId, Long transferredFromClassId);

    /**
     * 참여자가 어느 반이든 ACTIVE 수강을 가지고 있는지 (우선 대기 명단 배타 조건)
     */
    boolean existsByStudentIdAndStatus(Long studentId, EnrollmentStatus status);

    /**
     * 상태별 과정 목록 (신청 가능 반 필터링용)
     */
    @Query("""
        SELECT DISTINCT c.track FROM Enrollment e
        JOIN CourseClass c ON c.id = e.classId
        WHERE e.studentId = :studentId
        AND e.status IN :statuses
        """)
    List<ProgramTrack> findTracksByStudentIdAndStatusIn(
        @Param("studentId") Long studentId, @Param("statuses") Collection<EnrollmentStatus> statuses);

    /**
     * ACTIVE 카운트 (정원 캐시 검증용)
     */
    long countByClassIdAndStatus(Long classId, EnrollmentStatus status);

    /**
     * 반별 수강 목록 (운영자용)
     */
    List<Enrollment> findByClassIdOrderByCreatedAtAsc(Long classId);
}
