package com.example.studentrecords.models;

/**
 * Outcome of a single field validator. The message is empty when the field is valid.
 */
public record FieldCheck(boolean valid, String message) {

    private static final FieldCheck OK = new FieldCheck(true, "");

    public static FieldCheck ok() {
        return OK;
    }

    public static FieldCheck fail(String message) {
        return new FieldCheck(false, message);
    }
}
