package deskgate.core.service.upload;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import deskgate.core.model.upload.UploadCandidate;
import deskgate.core.model.upload.UploadRules;
import deskgate.core.model.upload.ValidationVerdict;
import deskgate.core.port.out.Metrics;
import deskgate.core.service.upload.stage.CompressionRatioStage;
import deskgate.core.service.upload.stage.ExecutableHeaderStage;
import deskgate.core.service.upload.stage.ExtensionBlocklistStage;
import deskgate.core.service.upload.stage.FilenameSanitationStage;
import deskgate.core.service.upload.stage.MaliciousContentStage;
import deskgate.core.service.upload.stage.MimeAllowlistStage;
import deskgate.core.service.upload.stage.SignatureStage;
import deskgate.core.service.upload.stage.SizeBoundStage;
import deskgate.core.service.upload.stage.UploadStage;

/**
 * Runs every upload through the integrity stages and returns the first rejection.
 *
 * <p>Cheap metadata checks run before byte-level ones. The executable check runs before
 * the signature check so a PE file is reported as an executable whatever type it claims.
 * Pure in-memory computation; safe to share between requests.
 */
@ApplicationScoped
public class UploadIntegrityPipeline {

    private static final Logger LOG = Logger.getLogger(UploadIntegrityPipeline.class);

    private final List<UploadStage> stages;
    private final Metrics metrics;

    @Inject
    public UploadIntegrityPipeline(UploadRules rules, Metrics metrics) {
        this(standardStages(rules), metrics);
    }

    public UploadIntegrityPipeline(List<UploadStage> stages, Metrics metrics) {
        this.stages = List.copyOf(stages);
        this.metrics = metrics;
    }

    /**
     * The standard stage order.
     *
     * @param rules the rules the stages check against
     * @return the stages
     */
    public static List<UploadStage> standardStages(UploadRules rules) {
        return List.of(
                new MimeAllowlistStage(rules),
                new ExtensionBlocklistStage(rules),
                new FilenameSanitationStage(),
                new SizeBoundStage(rules),
                new ExecutableHeaderStage(),
                new SignatureStage(rules),
                new MaliciousContentStage(rules),
                new CompressionRatioStage(rules));
    }

    /**
     * Validate one file.
     *
     * @param candidate the file
     * @param filesInRequest number of files in the same request
     * @return the verdict
     */
    public ValidationVerdict validate(UploadCandidate candidate, int filesInRequest) {
        for (final var stage : stages) {
            final var verdict = stage.inspect(candidate, filesInRequest);
            if (verdict instanceof ValidationVerdict.Rejected rejected) {
                LOG.debugv("Stage {0} rejected {1}: {2}", stage.name(), candidate, rejected.reason());
                metrics.recordUploadVerdict(verdict);
                return verdict;
            }
        }
        metrics.recordUploadVerdict(ValidationVerdict.accept());
        return ValidationVerdict.accept();
    }
}
