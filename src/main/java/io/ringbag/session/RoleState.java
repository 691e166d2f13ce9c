package io.ringbag.session;

/**
 * Lifecycle of a writer or reader: never opened, recording/replaying a bag, or done with the last one.
 */
public enum RoleState {
    NOT_OPEN,
    OPEN,
    CLOSED
}
