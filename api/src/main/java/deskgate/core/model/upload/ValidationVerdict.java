package deskgate.core.model.upload;

import java.util.Objects;

/**
 * Outcome of validating one upload.
 */
public sealed interface ValidationVerdict {

    record Accepted() implements ValidationVerdict {}

    record Rejected(RejectionReason reason, String message) implements ValidationVerdict {

        public Rejected {
            Objects.requireNonNull(reason, "reason must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    default boolean accepted() {
        return this instanceof Accepted;
    }

    static ValidationVerdict accept() {
        return new Accepted();
    }

    static ValidationVerdict reject(RejectionReason reason, String message) {
        return new Rejected(reason, message);
    }
}
