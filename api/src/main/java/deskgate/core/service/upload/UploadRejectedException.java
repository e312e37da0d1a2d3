package deskgate.core.service.upload;

import deskgate.core.model.upload.RejectionReason;
import deskgate.core.model.upload.ValidationVerdict;

/**
 * Thrown at the HTTP edge when an upload request is refused.
 *
 * <p>Terminal for the request; the caller gets the reason code and message, nothing else.
 */
public class UploadRejectedException extends RuntimeException {

    private final RejectionReason reason;

    public UploadRejectedException(ValidationVerdict.Rejected verdict) {
        super(verdict.message());
        this.reason = verdict.reason();
    }

    /** Returns the reason the upload was refused. */
    public RejectionReason getReason() {
        return reason;
    }
}
