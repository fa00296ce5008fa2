package com.bloomcart.scoring.service.footprint;

/**
 * Result of one call to an external footprint provider.
 *
 * <ul>
 *   <li><strong>OK</strong> - a usable value</li>
 *   <li><strong>REJECTED</strong> - the provider answered, but the answer is not good enough
 *       (no match, data quality below the gate)</li>
 *   <li><strong>UNAVAILABLE</strong> - timeout, transport error, non-2xx, malformed payload,
 *       or the provider is not configured</li>
 * </ul>
 *
 * <p>Both failure kinds trigger the next fallback tier; they are kept apart for logging.
 *
 * @param <T> Value type carried on success
 */
public final class ProviderOutcome<T> {

    public enum Kind { OK, REJECTED, UNAVAILABLE }

    private final Kind kind;
    private final T value;
    private final String reason;

    private ProviderOutcome(Kind kind, T value, String reason) {
        this.kind = kind;
        this.value = value;
        this.reason = reason;
    }

    public static <T> ProviderOutcome<T> ok(T value) {
        if (value == null) throw new IllegalArgumentException("ok outcome requires a value");
        return new ProviderOutcome<>(Kind.OK, value, null);
    }

    public static <T> ProviderOutcome<T> rejected(String reason) {
        return new ProviderOutcome<>(Kind.REJECTED, null, reason);
    }

    public static <T> ProviderOutcome<T> unavailable(String reason) {
        return new ProviderOutcome<>(Kind.UNAVAILABLE, null, reason);
    }

    public Kind getKind() { return kind; }
    public T getValue() { return value; }
    public String getReason() { return reason; }

    public boolean isOk() {
        return kind == Kind.OK;
    }

    /**
     * Re-types a failed outcome so it can be passed along a chain of calls.
     *
     * @throws IllegalStateException if this outcome is OK
     */
    public <U> ProviderOutcome<U> asFailure() {
        if (kind == Kind.OK) throw new IllegalStateException("outcome is OK");
        return new ProviderOutcome<>(kind, null, reason);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case OK -> "OK(" + value + ")";
            case REJECTED -> "REJECTED(" + reason + ")";
            case UNAVAILABLE -> "UNAVAILABLE(" + reason + ")";
        };
    }
}
