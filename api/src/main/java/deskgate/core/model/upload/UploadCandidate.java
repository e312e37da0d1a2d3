package deskgate.core.model.upload;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One uploaded file, fully buffered, as received from the caller.
 *
 * <p>The byte content is copied on construction and never exposed mutably, so every
 * validation stage sees the same bytes. Caller-supplied metadata (type, name, size) is
 * carried as declared and is only trusted after the pipeline re-checks it.
 */
public final class UploadCandidate {

    private final String fieldName;
    private final byte[] content;
    private final String declaredMimeType;
    private final String originalFilename;
    private final long declaredSize;

    public UploadCandidate(
            String fieldName, byte[] content, String declaredMimeType, String originalFilename, long declaredSize) {
        Objects.requireNonNull(content, "content must not be null");
        this.fieldName = fieldName;
        this.content = content.clone();
        this.declaredMimeType = declaredMimeType == null ? "" : declaredMimeType;
        this.originalFilename = originalFilename == null ? "" : originalFilename;
        this.declaredSize = declaredSize;
    }

    /**
     * Create a candidate whose declared size equals its true length.
     */
    public static UploadCandidate of(String fieldName, byte[] content, String mimeType, String filename) {
        return new UploadCandidate(fieldName, content, mimeType, filename, content.length);
    }

    public String fieldName() {
        return fieldName;
    }

    public String declaredMimeType() {
        return declaredMimeType;
    }

    public String originalFilename() {
        return originalFilename;
    }

    public long declaredSize() {
        return declaredSize;
    }

    /**
     * The true byte length, independent of what the caller declared.
     *
     * @return number of bytes received
     */
    public int length() {
        return content.length;
    }

    /**
     * Whether the content starts with the given bytes.
     *
     * @param prefix the expected leading bytes
     * @return true if every prefix byte matches
     */
    public boolean startsWith(byte[] prefix) {
        if (prefix.length > content.length) {
            return false;
        }
        return Arrays.equals(content, 0, prefix.length, prefix, 0, prefix.length);
    }

    /**
     * Decode up to {@code maxBytes} leading bytes as UTF-8 text.
     *
     * @param maxBytes the scan window
     * @return the decoded prefix
     */
    public String textPrefix(int maxBytes) {
        return new String(content, 0, Math.min(content.length, maxBytes), StandardCharsets.UTF_8);
    }

    /**
     * A copy of the content, for hand-off once the candidate has been accepted.
     *
     * @return the bytes
     */
    public byte[] content() {
        return content.clone();
    }

    @Override
    public String toString() {
        return "UploadCandidate[field=%s, filename=%s, type=%s, size=%d]"
                .formatted(fieldName, originalFilename, declaredMimeType, content.length);
    }
}
