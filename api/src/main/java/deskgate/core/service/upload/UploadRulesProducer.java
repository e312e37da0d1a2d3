package deskgate.core.service.upload;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import deskgate.core.config.UploadConfig;
import deskgate.core.model.upload.FileSignature;
import deskgate.core.model.upload.UploadRules;

/**
 * CDI producer for the upload rules.
 *
 * <p>Combines the built-in signature and pattern tables with whatever configuration adds.
 */
@ApplicationScoped
public class UploadRulesProducer {

    private static final Logger LOG = Logger.getLogger(UploadRulesProducer.class);

    static final Map<String, String> REFERENCE_SIGNATURES = Map.of(
            "image/jpeg", "FFD8FF",
            "image/png", "89504E47",
            "image/gif", "47494638",
            "application/pdf", "25504446",
            "application/zip", "504B0304",
            "application/x-zip-compressed", "504B0304");

    static final List<String> REFERENCE_PATTERNS = List.of(
            "<script\\b[^<]*(?:(?!</script>)<[^<]*)*</script>",
            "javascript:",
            "vbscript:",
            "onload\\s*=",
            "onerror\\s*=",
            "onclick\\s*=",
            "eval\\s*\\(",
            "document\\.write",
            "window\\.location",
            "%3Cscript",
            "%3C%2Fscript%3E");

    private final UploadConfig config;

    @Inject
    public UploadRulesProducer(UploadConfig config) {
        this.config = config;
    }

    /**
     * Produces the upload rules for CDI injection.
     *
     * @return the rules
     */
    @Produces
    @Singleton
    public UploadRules uploadRules() {
        final var rules = build(config);
        LOG.infov(
                "Upload validation: {0} allowed types, {1} blocked extensions, {2} signatures, max {3} bytes x {4} files",
                rules.allowedMimeTypes().size(),
                rules.blockedExtensions().size(),
                rules.signatures().size(),
                rules.maxFileSize(),
                rules.maxFiles());
        return rules;
    }

    /**
     * Build rules from configuration.
     *
     * @param config the upload configuration
     * @return the rules
     */
    public static UploadRules build(UploadConfig config) {
        final var signatures = new LinkedHashMap<String, FileSignature>();
        REFERENCE_SIGNATURES.forEach((type, hex) -> signatures.put(type, FileSignature.ofHex(type, hex)));
        config.signatures().orElse(List.of()).forEach(entry -> {
            final var signature = parseSignature(entry);
            signatures.put(signature.mimeType(), signature);
        });

        final var patterns = new ArrayList<String>(REFERENCE_PATTERNS);
        config.maliciousPatterns().ifPresent(patterns::addAll);

        return new UploadRules(
                new HashSet<>(config.allowedMimeTypes()),
                new HashSet<>(config.blockedExtensions()),
                signatures,
                compile(patterns),
                config.maxFileSize(),
                config.maxFiles(),
                config.maxFields(),
                config.maxFieldNameSize(),
                config.maxFieldSize(),
                config.scanWindow(),
                config.maxCompressionRatio());
    }

    /**
     * The rules as shipped, without any configuration.
     *
     * @return the reference rules
     */
    public static UploadRules referenceRules() {
        final var signatures = new LinkedHashMap<String, FileSignature>();
        REFERENCE_SIGNATURES.forEach((type, hex) -> signatures.put(type, FileSignature.ofHex(type, hex)));
        return new UploadRules(
                new HashSet<>(Arrays.asList(UploadConfig.DEFAULT_ALLOWED_MIME_TYPES.split(","))),
                new HashSet<>(Arrays.asList(UploadConfig.DEFAULT_BLOCKED_EXTENSIONS.split(","))),
                signatures,
                compile(REFERENCE_PATTERNS),
                10_485_760L,
                5,
                10,
                100,
                1_048_576L,
                1024,
                100.0);
    }

    static FileSignature parseSignature(String entry) {
        final var separator = entry.lastIndexOf('=');
        if (separator <= 0 || separator == entry.length() - 1) {
            throw new IllegalArgumentException("Signature must be written as mime/type=HEX: " + entry);
        }
        return FileSignature.ofHex(entry.substring(0, separator).trim(), entry.substring(separator + 1).trim());
    }

    private static List<Pattern> compile(List<String> patterns) {
        return patterns.stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
