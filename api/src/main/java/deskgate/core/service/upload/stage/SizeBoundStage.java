package deskgate.core.service.upload.stage;

import deskgate.core.model.upload.RejectionReason;
import deskgate.core.model.upload.UploadCandidate;
import deskgate.core.model.upload.UploadRules;
import deskgate.core.model.upload.ValidationVerdict;

/**
 * Bounds the true byte length of each file and the number of files per request.
 */
public final class SizeBoundStage implements UploadStage {

    private final UploadRules rules;

    public SizeBoundStage(UploadRules rules) {
        this.rules = rules;
    }

    @Override
    public ValidationVerdict inspect(UploadCandidate candidate, int filesInRequest) {
        if (filesInRequest > rules.maxFiles()) {
            return ValidationVerdict.reject(
                    RejectionReason.TOO_MANY_FILES, "Too many files. Maximum is " + rules.maxFiles());
        }
        if (candidate.length() > rules.maxFileSize()) {
            return ValidationVerdict.reject(
                    RejectionReason.FILE_TOO_LARGE, "File too large. Maximum size is " + rules.maxFileSize() + " bytes");
        }
        return ValidationVerdict.accept();
    }

    @Override
    public String name() {
        return "size";
    }
}
