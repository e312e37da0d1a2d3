package deskgate.core.model.upload;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The tables and limits the upload pipeline checks against.
 *
 * <p>All lists are configuration. The pipeline stages only interpret them, so the
 * heuristics can be extended without touching the stage code.
 *
 * @param allowedMimeTypes declared types that may be uploaded
 * @param blockedExtensions extensions (with leading dot, lower case) that are refused
 * @param signatures magic bytes per declared type
 * @param maliciousPatterns patterns searched for in the content prefix
 * @param maxFileSize bytes allowed per file
 * @param maxFiles files allowed per request
 * @param maxFields non-file fields allowed per request
 * @param maxFieldNameSize bytes allowed per field name
 * @param maxFieldSize bytes allowed per field value
 * @param scanWindow bytes of content the heuristic scan inspects
 * @param maxCompressionRatio declared-to-received size ratio above which zip uploads are refused
 */
public record UploadRules(
        Set<String> allowedMimeTypes,
        Set<String> blockedExtensions,
        Map<String, FileSignature> signatures,
        List<Pattern> maliciousPatterns,
        long maxFileSize,
        int maxFiles,
        int maxFields,
        int maxFieldNameSize,
        long maxFieldSize,
        int scanWindow,
        double maxCompressionRatio) {

    public UploadRules {
        allowedMimeTypes = allowedMimeTypes.stream()
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        blockedExtensions = blockedExtensions.stream()
                .map(UploadRules::normalizeExtension)
                .collect(Collectors.toUnmodifiableSet());
        signatures = signatures.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        e -> e.getKey().trim().toLowerCase(Locale.ROOT), Map.Entry::getValue));
        maliciousPatterns = List.copyOf(maliciousPatterns);
        if (maxFileSize <= 0 || maxFiles <= 0) {
            throw new IllegalArgumentException("maxFileSize and maxFiles must be positive");
        }
        if (scanWindow <= 0) {
            throw new IllegalArgumentException("scanWindow must be positive");
        }
    }

    public boolean isAllowedType(String mimeType) {
        return allowedMimeTypes.contains(normalizeType(mimeType));
    }

    public boolean isBlockedExtension(String extension) {
        return !extension.isEmpty() && blockedExtensions.contains(normalizeExtension(extension));
    }

    public Optional<FileSignature> signatureFor(String mimeType) {
        return Optional.ofNullable(signatures.get(normalizeType(mimeType)));
    }

    /**
     * Whether a declared type belongs to the zip family.
     *
     * @param mimeType the declared type
     * @return true if the type names zip
     */
    public static boolean isZipFamily(String mimeType) {
        return normalizeType(mimeType).contains("zip");
    }

    static String normalizeType(String mimeType) {
        if (mimeType == null) {
            return "";
        }
        final var semicolon = mimeType.indexOf(';');
        final var bare = semicolon >= 0 ? mimeType.substring(0, semicolon) : mimeType;
        return bare.trim().toLowerCase(Locale.ROOT);
    }

    static String normalizeExtension(String extension) {
        final var lower = extension.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith(".") ? lower : "." + lower;
    }
}
