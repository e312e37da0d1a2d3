package deskgate.core.service.upload.stage;

import deskgate.core.model.upload.RejectionReason;
import deskgate.core.model.upload.UploadCandidate;
import deskgate.core.model.upload.UploadRules;
import deskgate.core.model.upload.ValidationVerdict;

/**
 * Heuristic scan of the content prefix for script and handler patterns.
 *
 * <p>Best effort only: a match rejects, a miss proves nothing. Content is not sanitized.
 */
public final class MaliciousContentStage implements UploadStage {

    private final UploadRules rules;

    public MaliciousContentStage(UploadRules rules) {
        this.rules = rules;
    }

    @Override
    public ValidationVerdict inspect(UploadCandidate candidate, int filesInRequest) {
        final var text = candidate.textPrefix(rules.scanWindow());
        for (final var pattern : rules.maliciousPatterns()) {
            if (pattern.matcher(text).find()) {
                return ValidationVerdict.reject(
                        RejectionReason.MALICIOUS_CONTENT, "File contains potentially malicious content");
            }
        }
        return ValidationVerdict.accept();
    }

    @Override
    public String name() {
        return "content-scan";
    }
}
