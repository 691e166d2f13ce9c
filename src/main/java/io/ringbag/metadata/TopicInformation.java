package io.ringbag.metadata;

import io.ringbag.core.model.TopicDescriptor;

/**
 * A topic recorded in a bag together with the number of messages written to it.
 */
public record TopicInformation(TopicDescriptor topic, long messageCount) {
}
