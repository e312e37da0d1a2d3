package deskgate.core.service.upload.stage;

import deskgate.core.model.upload.RejectionReason;
import deskgate.core.model.upload.UploadCandidate;
import deskgate.core.model.upload.UploadRules;
import deskgate.core.model.upload.ValidationVerdict;

/**
 * Coarse zip-bomb indicator: a zip whose declared size dwarfs the bytes received.
 *
 * <p>Archives are not decompressed.
 */
public final class CompressionRatioStage implements UploadStage {

    private final UploadRules rules;

    public CompressionRatioStage(UploadRules rules) {
        this.rules = rules;
    }

    @Override
    public ValidationVerdict inspect(UploadCandidate candidate, int filesInRequest) {
        if (!UploadRules.isZipFamily(candidate.declaredMimeType()) || candidate.length() == 0) {
            return ValidationVerdict.accept();
        }
        final var ratio = (double) candidate.declaredSize() / candidate.length();
        if (ratio > rules.maxCompressionRatio()) {
            return ValidationVerdict.reject(
                    RejectionReason.SUSPICIOUS_COMPRESSION, "Suspicious compression ratio detected");
        }
        return ValidationVerdict.accept();
    }

    @Override
    public String name() {
        return "compression-ratio";
    }
}
