package io.ringbag.storage;

public enum OpenMode {
    WRITE,
    READ
}
