package com.example.studentrecords.service;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

public class StudentRecordException extends RuntimeException {

    public enum Code {
        VALIDATION_FAILED,
        STUDENT_NOT_FOUND,
        INVALID_REQUEST
    }

    @Getter
    private final Code code;

    // individual rule violations, empty unless code is VALIDATION_FAILED
    @Getter
    private final List<String> errors;

    private StudentRecordException(Code code, String message, List<String> errors) {
        super(message);
        this.code = code;
        this.errors = List.copyOf(errors);
    }

    public static StudentRecordException validationFailed(List<String> errors) {
        String bullets = errors.stream()
                .map(error -> "- " + error)
                .collect(Collectors.joining("\n"));
        return new StudentRecordException(Code.VALIDATION_FAILED, "Validation failed:\n" + bullets, errors);
    }

    public static StudentRecordException importRejected(List<String> rowErrors) {
        return new StudentRecordException(Code.VALIDATION_FAILED,
                "Import failed due to validation errors:\n" + String.join("\n", rowErrors), rowErrors);
    }

    public static StudentRecordException studentNotFound(String studentId) {
        return new StudentRecordException(Code.STUDENT_NOT_FOUND,
                "Student with ID '" + studentId + "' not found.", List.of());
    }

    public static StudentRecordException emptyStudentId() {
        return new StudentRecordException(Code.INVALID_REQUEST, "Student ID cannot be empty.", List.of());
    }

    public static StudentRecordException emptySearchTerm() {
        return new StudentRecordException(Code.INVALID_REQUEST, "Search term cannot be empty.", List.of());
    }

    public static StudentRecordException invalidSearchField(String field, String validFields) {
        return new StudentRecordException(Code.INVALID_REQUEST,
                "Invalid search field '" + field + "'. Valid fields: " + validFields, List.of());
    }
}
