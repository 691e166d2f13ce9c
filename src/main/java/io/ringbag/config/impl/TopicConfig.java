package io.ringbag.config.impl;

import io.ringbag.core.model.TopicDescriptor;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A topic entry of the {@code topics} list in a storage options file. Every listed topic is created as soon as
 * a writer opens a bag with those options.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public final class TopicConfig {
    private String name;
    private String type;
    private String format;

    public TopicDescriptor toDescriptor() {
        return new TopicDescriptor(name, type, format);
    }
}
