package deskgate.core.service.upload;

import java.nio.charset.StandardCharsets;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import deskgate.core.model.upload.RejectionReason;
import deskgate.core.model.upload.UploadForm;
import deskgate.core.model.upload.UploadRules;
import deskgate.core.model.upload.ValidationVerdict;

/**
 * Multipart-level limits, checked before any file is inspected.
 */
@ApplicationScoped
public class FormLimits {

    /** Allowance for the boundary and part headers of one multipart part. */
    static final long PART_OVERHEAD = 1024;

    private final UploadRules rules;

    @Inject
    public FormLimits(UploadRules rules) {
        this.rules = rules;
    }

    /**
     * Check a parsed form against the limits of a route.
     *
     * @param form the parsed form
     * @param fileField the only field name allowed to carry files
     * @param maxFiles files the route accepts
     * @return accepted, or the first violated limit
     */
    public ValidationVerdict check(UploadForm form, String fileField, int maxFiles) {
        for (final var file : form.files()) {
            if (!fileField.equals(file.fieldName())) {
                return ValidationVerdict.reject(
                        RejectionReason.UNEXPECTED_FILE, "Unexpected file field " + file.fieldName());
            }
        }
        final var limit = Math.min(maxFiles, rules.maxFiles());
        if (form.files().size() > limit) {
            return ValidationVerdict.reject(RejectionReason.TOO_MANY_FILES, "Too many files. Maximum is " + limit);
        }
        for (final var file : form.files()) {
            if (file.length() > rules.maxFileSize()) {
                return ValidationVerdict.reject(
                        RejectionReason.FILE_TOO_LARGE,
                        "File too large. Maximum size is " + rules.maxFileSize() + " bytes");
            }
        }
        if (form.fieldCount() > rules.maxFields()) {
            return ValidationVerdict.reject(
                    RejectionReason.TOO_MANY_FIELDS, "Too many fields. Maximum is " + rules.maxFields());
        }
        for (final var field : form.fields().entrySet()) {
            if (utf8Length(field.getKey()) > rules.maxFieldNameSize()) {
                return ValidationVerdict.reject(RejectionReason.FIELD_TOO_LARGE, "Field name too long");
            }
            for (final var value : field.getValue()) {
                if (utf8Length(value) > rules.maxFieldSize()) {
                    return ValidationVerdict.reject(
                            RejectionReason.FIELD_TOO_LARGE, "Field " + field.getKey() + " is too large");
                }
            }
        }
        return ValidationVerdict.accept();
    }

    /**
     * Largest body a well-formed upload request can have: every file and field at its limit,
     * plus multipart framing.
     *
     * @return the byte limit
     */
    public long maxRequestBytes() {
        final long files = rules.maxFileSize() * rules.maxFiles();
        final long fields = (long) rules.maxFields() * (rules.maxFieldNameSize() + rules.maxFieldSize());
        return files + fields + (rules.maxFiles() + rules.maxFields()) * PART_OVERHEAD;
    }

    /**
     * Check the declared length of an upload body before any of it is read.
     *
     * @param contentLength the {@code Content-Length}, or a negative value when not declared
     * @return accepted, or {@code FILE_TOO_LARGE} when no valid upload could be that long
     */
    public ValidationVerdict checkDeclaredLength(long contentLength) {
        if (contentLength > maxRequestBytes()) {
            return ValidationVerdict.reject(
                    RejectionReason.FILE_TOO_LARGE,
                    "File too large. Maximum size is " + rules.maxFileSize() + " bytes");
        }
        return ValidationVerdict.accept();
    }

    private static long utf8Length(String value) {
        return value == null ? 0 : value.getBytes(StandardCharsets.UTF_8).length;
    }
}
