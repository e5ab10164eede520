package io.fullerstack.rmw;

/**
 * Discrete result codes returned by the middleware-facing lifecycle operations.
 * <p>
 * These operations never throw for caller mistakes; they return one of these codes and
 * record a human readable message in {@link io.fullerstack.rmw.error.ErrorState}.
 */
public enum ReturnCode {
    OK,
    ERROR,
    TIMEOUT,
    UNSUPPORTED,
    INVALID_ARGUMENT,
    BAD_ALLOC,
    INCORRECT_RMW_IMPLEMENTATION;

    public boolean isOk() {
        return this == OK;
    }
}
