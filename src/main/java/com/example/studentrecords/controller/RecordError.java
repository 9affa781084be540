package com.example.studentrecords.controller;

import java.util.List;

/**
 * Structured description of a failed operation.
 *
 * @param kind    what went wrong
 * @param message human-readable summary
 * @param details individual violations, for validation failures
 */
public record RecordError(Kind kind, String message, List<String> details) {

    public enum Kind {
        VALIDATION,
        NOT_FOUND,
        INVALID_REQUEST,
        INTERNAL
    }

    public RecordError {
        details = details == null ? List.of() : List.copyOf(details);
    }

    public RecordError(Kind kind, String message) {
        this(kind, message, List.of());
    }
}
