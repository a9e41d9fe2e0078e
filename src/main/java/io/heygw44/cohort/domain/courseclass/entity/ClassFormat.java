package io.heygw44.cohort.domain.courseclass.entity;

public enum ClassFormat {
    ONLINE,
    IN_PERSON
}
