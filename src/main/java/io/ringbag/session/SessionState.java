package io.ringbag.session;

public enum SessionState {
    CLOSED,
    OPEN
}
