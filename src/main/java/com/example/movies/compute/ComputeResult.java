package com.example.movies.compute;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ComputeResult {

    @Getter
    @AllArgsConstructor
    public enum Outcome {
        SUCCESS(200),
        VALIDATION_ERROR(400),
        STORAGE_ERROR(502),
        INTERNAL_ERROR(500);

        private final int statusCode;
    }

    Outcome outcome;
    String body;
    String errorMessage;

    public static ComputeResult success(String body) {
        return new ComputeResult(Outcome.SUCCESS, body, null);
    }

    public static ComputeResult validationError(String message) {
        return new ComputeResult(Outcome.VALIDATION_ERROR, null, message);
    }

    public static ComputeResult storageError(String message) {
        return new ComputeResult(Outcome.STORAGE_ERROR, null, message);
    }

    public static ComputeResult internalError(String message) {
        return new ComputeResult(Outcome.INTERNAL_ERROR, null, message);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
