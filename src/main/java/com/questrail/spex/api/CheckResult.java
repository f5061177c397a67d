package com.questrail.spex.api;

import java.util.Objects;

/**
 * CheckResult
 * -----------------------------------------------------------------------------
 * Status value returned by the {@code check()} validators.
 *
 * <p>Validators never throw. They report the first violated invariant as a
 * failed result and leave it to the caller to decide whether the condition
 * is acceptable. Conversion entry points treat a failing result on their own
 * output as fatal.</p>
 *
 * @param ok      true if every invariant holds
 * @param message description of the first violation, empty when {@code ok}
 */
public record CheckResult(boolean ok, String message)
{
    private static final CheckResult OK = new CheckResult(true, "");

    public CheckResult {
        Objects.requireNonNull(message, "message");
        if (ok && !message.isEmpty()) {
            throw new IllegalArgumentException("A passing result carries no message");
        }
    }

    public static CheckResult passed() {
        return OK;
    }

    public static CheckResult failed(String message) {
        return new CheckResult(false, Objects.requireNonNull(message, "message"));
    }

    public boolean failed() {
        return !ok;
    }

    /**
     * Converts a failure into an {@link ArrayLengthMismatchException}.
     *
     * @param what short description of the checked object, used as message prefix
     * @throws ArrayLengthMismatchException if this result is a failure
     */
    public void orThrow(String what) {
        if (!ok) {
            throw new ArrayLengthMismatchException(what + ": " + message);
        }
    }
}
