package com.example.studentrecords.controller;

import java.util.Optional;

/**
 * Outcome of a controller operation: either a success carrying a message and an optional payload,
 * or a failure carrying a {@link RecordError}.
 */
public sealed interface OperationResult<T> permits OperationResult.Success, OperationResult.Failure {

    boolean succeeded();

    String message();

    Optional<T> payload();

    Optional<RecordError> error();

    static <T> OperationResult<T> success(String message, T payload) {
        return new Success<>(message, payload);
    }

    static <T> OperationResult<T> success(String message) {
        return new Success<>(message, null);
    }

    static <T> OperationResult<T> failure(RecordError error) {
        return new Failure<>(error);
    }

    record Success<T>(String message, T value) implements OperationResult<T> {

        @Override
        public boolean succeeded() {
            return true;
        }

        @Override
        public Optional<T> payload() {
            return Optional.ofNullable(value);
        }

        @Override
        public Optional<RecordError> error() {
            return Optional.empty();
        }
    }

    record Failure<T>(RecordError reason) implements OperationResult<T> {

        @Override
        public boolean succeeded() {
            return false;
        }

        @Override
        public String message() {
            return reason.message();
        }

        @Override
        public Optional<T> payload() {
            return Optional.empty();
        }

        @Override
        public Optional<RecordError> error() {
            return Optional.of(reason);
        }
    }
}
