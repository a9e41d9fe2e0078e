package io.heygw44.cohort.global.response;

public record FieldError(String field, String reason) {}
