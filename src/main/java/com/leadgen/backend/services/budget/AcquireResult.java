package com.leadgen.backend.services.budget;

/**
 * Outcome of a scheduler request: either the granted value or a denial.
 */
public final class AcquireResult<T> {

    private final T value;
    private final Denial denial;

    private AcquireResult(T value, Denial denial) {
        this.value = value;
        this.denial = denial;
    }

    public static <T> AcquireResult<T> granted(T value) {
        return new AcquireResult<>(value, null);
    }

    public static <T> AcquireResult<T> denied(Denial denial) {
        return new AcquireResult<>(null, denial);
    }

    public boolean isGranted() {
        return denial == null;
    }

    public T get() {
        if (denial != null) {
            throw new IllegalStateException("Request was denied: " + denial.message());
        }
        return value;
    }

    public Denial getDenial() {
        return denial;
    }
}
