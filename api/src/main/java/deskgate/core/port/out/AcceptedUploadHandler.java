package deskgate.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import deskgate.core.model.upload.UploadCandidate;

/**
 * Port for the business logic that receives uploads after every file has been accepted.
 *
 * <p>Never called with a file that failed validation.
 */
public interface AcceptedUploadHandler {

    /**
     * Receipt for one stored file.
     *
     * @param filename the original filename
     * @param mimeType the declared type
     * @param size the true byte length
     */
    record StoredFile(String filename, String mimeType, long size) {}

    /**
     * Take ownership of accepted uploads.
     *
     * @param files the accepted files
     * @param callerIdentity the authenticated caller, or {@code null}
     * @return a receipt per file, in the same order
     */
    Uni<List<StoredFile>> accept(List<UploadCandidate> files, String callerIdentity);
}
