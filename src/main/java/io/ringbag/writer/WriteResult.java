package io.ringbag.writer;

import io.ringbag.core.error.TopicTypeMismatchException;
import io.ringbag.core.model.TopicDescriptor;

/**
 * Outcome of a write that passed topic registration: either the envelope was accepted, or it declared
 * a type or format the topic is not registered with and nothing was recorded.
 */
public sealed interface WriteResult permits WriteResult.Accepted, WriteResult.TypeMismatch {

    static Accepted accepted(final long sequence) {
        return new Accepted(sequence);
    }

    static TypeMismatch typeMismatch(final TopicDescriptor registered, final String declaredType, final String declaredFormat) {
        return new TypeMismatch(registered, declaredType, declaredFormat);
    }

    boolean isAccepted();

    /**
     * @throws TopicTypeMismatchException if this is a {@link TypeMismatch}
     */
    default Accepted orThrow() {
        if (this instanceof TypeMismatch m) {
            throw new TopicTypeMismatchException(m.registered().name(), m.describe());
        }
        return (Accepted) this;
    }

    /**
     * @param sequence zero-based position of the message in the bag
     */
    record Accepted(long sequence) implements WriteResult {
        @Override
        public boolean isAccepted() {
            return true;
        }
    }

    record TypeMismatch(TopicDescriptor registered, String declaredType, String declaredFormat) implements WriteResult {
        @Override
        public boolean isAccepted() {
            return false;
        }

        public String describe() {
            return "Topic " + registered.name() + " is registered as " + registered.typeIdentifier() + "/"
                    + registered.serializationFormat() + " but the write declared " + declaredType + "/" + declaredFormat;
        }
    }
}
