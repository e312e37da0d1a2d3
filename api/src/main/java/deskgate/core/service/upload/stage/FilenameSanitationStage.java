package deskgate.core.service.upload.stage;

import deskgate.core.model.upload.RejectionReason;
import deskgate.core.model.upload.UploadCandidate;
import deskgate.core.model.upload.ValidationVerdict;

/**
 * Filenames must be a single path segment.
 */
public final class FilenameSanitationStage implements UploadStage {

    @Override
    public ValidationVerdict inspect(UploadCandidate candidate, int filesInRequest) {
        final var filename = candidate.originalFilename();
        if (filename.isBlank()) {
            return ValidationVerdict.reject(RejectionReason.INVALID_FILENAME, "Filename is missing");
        }
        if (filename.contains("..")
                || filename.indexOf('/') >= 0
                || filename.indexOf('\\') >= 0
                || filename.indexOf('\0') >= 0) {
            return ValidationVerdict.reject(RejectionReason.INVALID_FILENAME, "Invalid filename");
        }
        return ValidationVerdict.accept();
    }

    @Override
    public String name() {
        return "filename";
    }
}
