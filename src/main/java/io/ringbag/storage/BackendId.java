package io.ringbag.storage;

import io.ringbag.core.error.ConfigurationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The closed set of storage backends a session can be opened on.
 */
@Getter
@RequiredArgsConstructor
public enum BackendId {
    /** Memory-mapped, rolling segment files in a bag directory. */
    SEGMENT("segment", true),
    /** One append-only journal file in a bag directory. */
    JOURNAL("journal", true),
    /** Process-local bags keyed by location, gone when the JVM exits. */
    MEMORY("memory", false);

    public static final BackendId DEFAULT = SEGMENT;

    private final String identifier;
    /** Whether the location is a directory on the file system. */
    private final boolean fileBased;

    /**
     * @throws ConfigurationException if no backend has this identifier
     */
    public static BackendId fromIdentifier(final String identifier) {
        if (identifier == null) throw new ConfigurationException("Storage identifier must not be null");
        for (final BackendId id : values()) {
            if (id.identifier.equals(identifier)) return id;
        }
        throw new ConfigurationException("Unknown storage identifier '" + identifier + "', expected one of "
                + Arrays.stream(values()).map(BackendId::getIdentifier).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return identifier;
    }
}
