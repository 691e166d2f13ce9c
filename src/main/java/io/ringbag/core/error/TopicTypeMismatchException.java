package io.ringbag.core.error;

import lombok.Getter;

/**
 * Thrown by {@code WriteResult.orThrow()} when a write declared a type or format that differs from
 * the topic's registered descriptor.
 */
@Getter
public class TopicTypeMismatchException extends BagException {
    private final String topicName;

    public TopicTypeMismatchException(final String topicName, final String message) {
        super(message);
        this.topicName = topicName;
    }
}
