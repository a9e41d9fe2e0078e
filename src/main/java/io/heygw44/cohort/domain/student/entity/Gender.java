package io.heygw44.cohort.domain.student.entity;

public enum Gender {
    FEMALE,
    MALE,
    UNDISCLOSED
}
