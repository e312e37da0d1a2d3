package deskgate.core.model.upload;

/**
 * Machine-readable reasons an upload is refused.
 *
 * <p>The first nine come from the integrity pipeline; the rest describe multipart form
 * violations detected before any file is inspected.
 */
public enum RejectionReason {
    UNSUPPORTED_TYPE,
    DANGEROUS_EXTENSION,
    INVALID_FILENAME,
    FILE_TOO_LARGE,
    TOO_MANY_FILES,
    HEADER_MISMATCH,
    MALICIOUS_CONTENT,
    EXECUTABLE_REJECTED,
    SUSPICIOUS_COMPRESSION,
    UNEXPECTED_FILE,
    TOO_MANY_FIELDS,
    FIELD_TOO_LARGE;

    /**
     * The code sent to callers in the error envelope.
     *
     * @return the reason code
     */
    public String code() {
        return name();
    }
}
