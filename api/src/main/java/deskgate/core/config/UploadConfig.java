package deskgate.core.config;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for upload validation.
 *
 * <p>Configuration prefix: {@code deskgate.upload}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code MAX_FILE_SIZE} - Maximum bytes per file</li>
 *   <li>{@code MAX_FILES_PER_REQUEST} - Maximum files per request</li>
 * </ul>
 *
 * <p>Signatures and malicious-content patterns ship with built-in tables. Entries configured
 * here are added to them; a signature configured for a type already in the table replaces it.
 */
@ConfigMapping(prefix = "deskgate.upload")
public interface UploadConfig {

    String DEFAULT_ALLOWED_MIME_TYPES = "image/jpeg,image/png,image/gif,image/webp,application/pdf,"
            + "text/plain,text/csv,application/msword,"
            + "application/vnd.openxmlformats-officedocument.wordprocessingml.document,"
            + "application/vnd.ms-excel,application/vnd.openxmlformats-officedocument.spreadsheetml.sheet,"
            + "application/zip,application/x-zip-compressed";

    String DEFAULT_BLOCKED_EXTENSIONS = ".exe,.bat,.cmd,.com,.pif,.scr,.vbs,.js,.jar,.app,.deb,.pkg,.dmg,.rpm,"
            + ".msi,.run,.bin,.sh,.ps1,.php,.asp,.aspx,.jsp,.py,.rb,.pl";

    @WithDefault("10485760")
    long maxFileSize();

    @WithDefault("5")
    int maxFiles();

    @WithDefault("10")
    int maxFields();

    @WithDefault("100")
    int maxFieldNameSize();

    @WithDefault("1048576")
    long maxFieldSize();

    /**
     * Bytes of content the heuristic scan inspects.
     *
     * @return scan window (default: 1024)
     */
    @WithDefault("1024")
    int scanWindow();

    /**
     * Declared-to-received size ratio above which zip uploads are refused.
     *
     * @return the ratio (default: 100)
     */
    @WithDefault("100")
    double maxCompressionRatio();

    @WithDefault(DEFAULT_ALLOWED_MIME_TYPES)
    List<String> allowedMimeTypes();

    @WithDefault(DEFAULT_BLOCKED_EXTENSIONS)
    List<String> blockedExtensions();

    /**
     * Additional magic-byte signatures as {@code mime/type=HEX}, e.g. {@code image/webp=52494646}.
     */
    Optional<List<String>> signatures();

    /**
     * Additional case-insensitive patterns for the content scan.
     */
    Optional<List<String>> maliciousPatterns();
}
