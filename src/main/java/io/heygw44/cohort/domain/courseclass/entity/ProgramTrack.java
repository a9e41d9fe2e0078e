package io.heygw44.cohort.domain.courseclass.entity;

/**
 * 과정(트랙) enum
 * 참여자는 과정별로 동시에 하나의 반에만 수강 중일 수 있다.
 */
public enum ProgramTrack {
    CHURCH,         // 교회
    SPIRITUALITY,   // 영성
    GOSPEL          // 복음
}
