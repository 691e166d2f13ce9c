package io.ringbag.core.error;

import io.ringbag.core.model.TopicDescriptor;
import lombok.Getter;

/**
 * A topic registration contradicts the descriptor already bound to that name, or a write targets a topic
 * that was never registered.
 */
@Getter
public class TopicConflictException extends BagException {
    private final String topicName;
    private final TopicDescriptor existing;

    public TopicConflictException(final String topicName, final TopicDescriptor existing, final String message) {
        super(message);
        this.topicName = topicName;
        this.existing = existing;
    }

    public static TopicConflictException contradicts(final TopicDescriptor existing, final TopicDescriptor requested) {
        return new TopicConflictException(requested.name(), existing,
                "Topic " + requested.name() + " is registered as " + existing.typeIdentifier()
                        + "/" + existing.serializationFormat() + ", cannot re-register as "
                        + requested.typeIdentifier() + "/" + requested.serializationFormat());
    }

    public static TopicConflictException unregistered(final String topicName) {
        return new TopicConflictException(topicName, null,
                "Topic " + topicName + " has not been created and no descriptor was supplied");
    }
}
