package deskgate.core.service.upload.stage;

import deskgate.core.model.upload.RejectionReason;
import deskgate.core.model.upload.UploadCandidate;
import deskgate.core.model.upload.UploadRules;
import deskgate.core.model.upload.ValidationVerdict;

/**
 * Refuses executable and script extensions, whatever the declared type.
 *
 * <p>Only the last extension counts, so {@code invoice.pdf.exe} is caught. Trailing dots and
 * spaces are ignored because Windows strips them when the file is saved.
 */
public final class ExtensionBlocklistStage implements UploadStage {

    private final UploadRules rules;

    public ExtensionBlocklistStage(UploadRules rules) {
        this.rules = rules;
    }

    @Override
    public ValidationVerdict inspect(UploadCandidate candidate, int filesInRequest) {
        final var extension = extensionOf(candidate.originalFilename());
        if (!rules.isBlockedExtension(extension)) {
            return ValidationVerdict.accept();
        }
        return ValidationVerdict.reject(
                RejectionReason.DANGEROUS_EXTENSION, "File extension " + extension + " is not allowed");
    }

    @Override
    public String name() {
        return "extension-blocklist";
    }

    /**
     * The last extension of a filename, including its dot, or an empty string.
     *
     * @param filename the filename
     * @return e.g. {@code .exe}
     */
    static String extensionOf(String filename) {
        var trimmed = filename;
        while (!trimmed.isEmpty() && (trimmed.endsWith(".") || trimmed.endsWith(" "))) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        final var base = trimmed.substring(Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\')) + 1);
        final var dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(dot) : "";
    }
}
