package com.example.studentrecords.models;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Record fields a search may target, keyed by their serialized names.
 */
public enum SearchField {
    NAME(StudentRecord.FIELD_NAME, StudentRecord::getName),
    MAJOR(StudentRecord.FIELD_MAJOR, StudentRecord::getMajor),
    EMAIL(StudentRecord.FIELD_EMAIL, StudentRecord::getEmail),
    ID(StudentRecord.FIELD_ID, StudentRecord::getId);

    private final String key;
    private final Function<StudentRecord, Object> accessor;

    SearchField(String key, Function<StudentRecord, Object> accessor) {
        this.key = key;
        this.accessor = accessor;
    }

    public String key() {
        return key;
    }

    public String valueOf(StudentRecord record) {
        Object value = accessor.apply(record);
        return value == null ? "" : value.toString();
    }

    public static Optional<SearchField> fromKey(String key) {
        if (StudentRecord.FIELD_LEGACY_ID.equals(key)) {
            return Optional.of(ID);
        }
        return Arrays.stream(values())
                .filter(field -> field.key.equals(key))
                .findFirst();
    }

    public static String validKeys() {
        return Arrays.stream(values())
                .map(SearchField::key)
                .collect(Collectors.joining(", "));
    }
}
