package com.example.smartparkinggate.service;

import com.example.smartparkinggate.exception.ParkingGateException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Outcome of a call to an external collaborator whose failure the gate
 * tolerates. Exactly one of value or error is present; a successful call
 * without a payload carries {@code null} as value.
 */
public final class CollaboratorResult<T> {

    private final T value;
    private final ParkingGateException error;

    private CollaboratorResult(T value, ParkingGateException error) {
        this.value = value;
        this.error = error;
    }

    public static <T> CollaboratorResult<T> success(T value) {
        return new CollaboratorResult<>(value, null);
    }

    public static CollaboratorResult<Void> done() {
        return new CollaboratorResult<>(null, null);
    }

    public static <T> CollaboratorResult<T> failure(ParkingGateException error) {
        return new CollaboratorResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("Collaborator call failed", error);
        }
        return value;
    }

    public Optional<ParkingGateException> error() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the value, or hands the error to {@code onError} and returns the fallback.
     */
    public T orElse(T fallback, Consumer<ParkingGateException> onError) {
        if (error != null) {
            onError.accept(error);
            return fallback;
        }
        return value;
    }
}
