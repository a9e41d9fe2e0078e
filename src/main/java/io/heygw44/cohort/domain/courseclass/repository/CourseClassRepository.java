package io.heygw44.cohort.domain.courseclass.repository;

import io.heygw44.cohort.domain.courseclass.entity.CourseClass;
import io.heygw44.cohort.domain.courseclass.entity.ProgramTrack;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface CourseClassRepository extends JpaRepository<CourseClass, Long> {

    /**
     * 비관적 락 일괄 조회 (이동 시 두 반을 id 오름차순으로 잠가 교착 방지)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000")})
    @Query("SELECT c FROM CourseClass c WHERE c.id IN :ids ORDER BY c.id ASC")
    List<CourseClass> findAllByIdForUpdate(@Param("ids") Collection<Long> ids);

    /**
     * 신청 가능한 반 목록 (운영 중, 보관되지 않음)
     */
    @Query("""
        SELECT c FROM CourseClass c
        WHERE c.active = true
        AND c.archived = false
        AND c.track NOT IN :excludedTracks
        ORDER BY c.track ASC, c.city ASC, c.startsAt ASC
        """)
    List<CourseClass> findOpenClassesExcludingTracks(
        @Param("excludedTracks") Collection<ProgramTrack> excludedTracks);

    @Query("""
        SELECT c FROM CourseClass c
        WHERE c.active = true
        AND c.archived = false
        ORDER BY c.track ASC, c.city ASC, c.startsAt ASC
        """)
    List<CourseClass> findOpenClasses();
}
