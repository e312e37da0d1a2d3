package deskgate.core.service.upload.stage;

import deskgate.core.model.upload.UploadCandidate;
import deskgate.core.model.upload.ValidationVerdict;

/**
 * One independent check of the upload integrity pipeline.
 *
 * <p>Stages never mutate the candidate and each is sufficient on its own to reject it.
 */
public interface UploadStage {

    /**
     * Inspect a file.
     *
     * @param candidate the file
     * @param filesInRequest number of files in the same request
     * @return accepted, or the rejection of this stage
     */
    ValidationVerdict inspect(UploadCandidate candidate, int filesInRequest);

    /**
     * Short stage name for logs.
     *
     * @return the name
     */
    String name();
}
