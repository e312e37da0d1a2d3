package deskgate.core.service.upload.stage;

import deskgate.core.model.upload.RejectionReason;
import deskgate.core.model.upload.UploadCandidate;
import deskgate.core.model.upload.UploadRules;
import deskgate.core.model.upload.ValidationVerdict;

/**
 * Only declared types on the allowlist pass.
 */
public final class MimeAllowlistStage implements UploadStage {

    private final UploadRules rules;

    public MimeAllowlistStage(UploadRules rules) {
        this.rules = rules;
    }

    @Override
    public ValidationVerdict inspect(UploadCandidate candidate, int filesInRequest) {
        if (rules.isAllowedType(candidate.declaredMimeType())) {
            return ValidationVerdict.accept();
        }
        return ValidationVerdict.reject(
                RejectionReason.UNSUPPORTED_TYPE,
                "File type " + candidate.declaredMimeType() + " is not allowed");
    }

    @Override
    public String name() {
        return "mime-allowlist";
    }
}
