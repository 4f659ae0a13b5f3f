package com.example.chatterbox.service;

import java.util.Objects;

/**
 * Result of a message store operation: either the affected value or the kind of
 * expected failure together with a client-facing message.
 *
 * @param <T> type of the value carried on success
 */
public final class StoreOutcome<T> {

    public enum Status {
        OK,
        NOT_FOUND,
        INVALID
    }

    private final Status status;
    private final T value;
    private final String message;

    private StoreOutcome(Status status, T value, String message) {
        this.status = Objects.requireNonNull(status, "status");
        this.value = value;
        this.message = message;
    }

    public static <T> StoreOutcome<T> ok(T value) {
        return new StoreOutcome<>(Status.OK, value, null);
    }

    public static <T> StoreOutcome<T> notFound(String message) {
        return new StoreOutcome<>(Status.NOT_FOUND, null, message);
    }

    public static <T> StoreOutcome<T> invalid(String message) {
        return new StoreOutcome<>(Status.INVALID, null, message);
    }

    public Status status() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    /**
     * @return the affected value, or {@code null} unless {@link #isOk()}
     */
    public T value() {
        return value;
    }

    /**
     * @return the failure message, or {@code null} when {@link #isOk()}
     */
    public String message() {
        return message;
    }

    @Override
    public String toString() {
        return "StoreOutcome{status=" + status + ", value=" + value + ", message=" + message + "}";
    }
}
