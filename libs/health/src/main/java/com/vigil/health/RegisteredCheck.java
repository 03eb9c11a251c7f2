package com.vigil.health;

/**
 * A check as stored by the engine after successful registration.
 *
 * @param check   check identity and metadata
 * @param options effective options, with engine defaults applied
 * @param checker timeout-enforcing executable form of the check
 */
public record RegisteredCheck(Check check, CheckerOptions options, Checker checker) {

    public RegisteredCheck {
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        if (checker == null) {
            throw new IllegalArgumentException("checker must not be null");
        }
    }

    /** Returns the check id. */
    public String id() {
        return check.id();
    }
}
