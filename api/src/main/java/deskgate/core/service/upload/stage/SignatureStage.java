package deskgate.core.service.upload.stage;

import deskgate.core.model.upload.RejectionReason;
import deskgate.core.model.upload.UploadCandidate;
import deskgate.core.model.upload.UploadRules;
import deskgate.core.model.upload.ValidationVerdict;

/**
 * The leading bytes must match the signature of the declared type.
 *
 * <p>Types without a known signature pass, and so do files shorter than four bytes.
 */
public final class SignatureStage implements UploadStage {

    static final int MIN_LENGTH = 4;

    private final UploadRules rules;

    public SignatureStage(UploadRules rules) {
        this.rules = rules;
    }

    @Override
    public ValidationVerdict inspect(UploadCandidate candidate, int filesInRequest) {
        if (candidate.length() < MIN_LENGTH) {
            return ValidationVerdict.accept();
        }
        return rules.signatureFor(candidate.declaredMimeType())
                .filter(signature -> !candidate.startsWith(signature.magic()))
                .map(signature -> ValidationVerdict.reject(
                        RejectionReason.HEADER_MISMATCH,
                        "File header does not match declared MIME type " + signature.mimeType()))
                .orElseGet(ValidationVerdict::accept);
    }

    @Override
    public String name() {
        return "signature";
    }
}
