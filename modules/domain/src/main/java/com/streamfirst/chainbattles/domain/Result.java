package com.streamfirst.chainbattles.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of a registry operation: either success with data, or failure with a
 * {@link RegistryError} and a human readable message.
 *
 * @param <T> the type of data returned on success
 */
@EqualsAndHashCode
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final RegistryError error;
    private final String errorMessage;

    private Result(boolean success, T data, RegistryError error, String errorMessage) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorMessage = errorMessage;
    }

    /**
     * Creates a successful result with data.
     */
    public static <T> Result<T> success(@NonNull T data) {
        return new Result<>(true, data, null, null);
    }

    /**
     * Creates a successful result without data (for void operations).
     */
    public static Result<Void> success() {
        return new Result<>(true, null, null, null);
    }

    /**
     * Creates a failure result.
     */
    public static <T> Result<T> failure(@NonNull RegistryError error, @NonNull String errorMessage) {
        return new Result<>(false, null, error, errorMessage);
    }

    /**
     * Returns the data if successful, or throws a {@link RegistryException} if failed.
     */
    public T orElseThrow() {
        if (success) {
            return data;
        }
        throw new RegistryException(error, errorMessage);
    }

    /**
     * Returns the data if successful, or the provided default value if failed.
     */
    public T orElse(T defaultValue) {
        return success ? data : defaultValue;
    }

    /**
     * Returns the data if successful, or gets it from the provided supplier if failed.
     */
    public T orElseGet(Supplier<T> supplier) {
        return success ? data : supplier.get();
    }

    /**
     * Maps the data to another type if successful, preserves failure if failed.
     */
    public <U> Result<U> map(Function<T, U> mapper) {
        if (success) {
            return Result.success(mapper.apply(data));
        }
        return Result.failure(error, errorMessage);
    }

    /**
     * Flat maps the data to another Result if successful, preserves failure if failed.
     */
    public <U> Result<U> flatMap(Function<T, Result<U>> mapper) {
        if (success) {
            return mapper.apply(data);
        }
        return Result.failure(error, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Gets the data if successful, empty otherwise.
     */
    public Optional<T> getData() {
        return success ? Optional.ofNullable(data) : Optional.empty();
    }

    /**
     * Gets the error if failed, empty otherwise.
     */
    public Optional<RegistryError> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Gets the error message if failed, empty otherwise.
     */
    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        if (success) {
            return "Result.success(" + data + ")";
        }
        return "Result.failure(" + errorMessage + ", code=" + error.code() + ")";
    }
}
