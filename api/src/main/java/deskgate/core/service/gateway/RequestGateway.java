package deskgate.core.service.gateway;

import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import deskgate.core.config.AdmissionConfig;
import deskgate.core.model.admission.AdmissionDecision;
import deskgate.core.model.admission.RequestDescriptor;
import deskgate.core.model.admission.RouteClass;
import deskgate.core.model.upload.UploadForm;
import deskgate.core.model.upload.ValidationVerdict;
import deskgate.core.port.out.AcceptedUploadHandler;
import deskgate.core.port.out.AcceptedUploadHandler.StoredFile;
import deskgate.core.service.admission.AdmissionController;
import deskgate.core.service.admission.PolicyRegistry;
import deskgate.core.service.admission.RouteClassifier;
import deskgate.core.service.upload.FormLimits;
import deskgate.core.service.upload.UploadIntegrityPipeline;
import deskgate.core.service.upload.UploadRejectedException;

/**
 * Wires route classes to their policies and sequences admission before upload validation.
 *
 * <p>Admission runs first for every classified request. Upload routes are only validated
 * once admitted, and files only reach the {@link AcceptedUploadHandler} when every file of
 * the request passed.
 */
@ApplicationScoped
public class RequestGateway {

    private static final Logger LOG = Logger.getLogger(RequestGateway.class);

    private final boolean admissionEnabled;
    private final RouteClassifier classifier;
    private final PolicyRegistry policies;
    private final AdmissionController admission;
    private final FormLimits formLimits;
    private final UploadIntegrityPipeline pipeline;
    private final AcceptedUploadHandler uploadHandler;

    @Inject
    public RequestGateway(
            AdmissionConfig config,
            RouteClassifier classifier,
            PolicyRegistry policies,
            AdmissionController admission,
            FormLimits formLimits,
            UploadIntegrityPipeline pipeline,
            AcceptedUploadHandler uploadHandler) {
        this.admissionEnabled = config.enabled();
        this.classifier = classifier;
        this.policies = policies;
        this.admission = admission;
        this.formLimits = formLimits;
        this.pipeline = pipeline;
        this.uploadHandler = uploadHandler;
    }

    /**
     * Files of one upload request, as parsed by the HTTP edge.
     *
     * @param form the parsed multipart form
     * @param fileField the field the route reads files from
     * @param maxFiles files the route accepts
     * @param callerIdentity the authenticated caller, or {@code null}
     * @param clientIp the caller IP, or {@code null}
     */
    public record UploadRequest(
            UploadForm form, String fileField, int maxFiles, String callerIdentity, String clientIp) {}

    /**
     * Classify a request into its route class.
     *
     * @param method the HTTP method
     * @param path the request path
     * @return the route class, empty when the request is not limited
     */
    public Optional<RouteClass> classify(String method, String path) {
        if (!admissionEnabled) {
            return Optional.empty();
        }
        return classifier.classify(method, path);
    }

    /**
     * Run admission control for a classified request. Never fails.
     *
     * @param request the request descriptor
     * @return the decision
     */
    public Uni<AdmissionDecision> admit(RequestDescriptor request) {
        if (!admissionEnabled) {
            return Uni.createFrom().item(AdmissionDecision.unlimited());
        }
        return policies.policyFor(request.routeClass())
                .map(policy -> admission.admit(request, policy))
                .orElseGet(() -> Uni.createFrom().item(AdmissionDecision.unlimited()));
    }

    /**
     * Post-request hook, called with the final response status. Never fails.
     *
     * @param routeClass the route class of the request
     * @param decision its admission decision
     * @param status the final response status
     * @return completes once any slot release has been attempted
     */
    public Uni<Void> complete(RouteClass routeClass, AdmissionDecision decision, int status) {
        return policies.policyFor(routeClass)
                .map(policy -> admission.complete(policy, decision, status))
                .orElseGet(() -> Uni.createFrom().voidItem());
    }

    /**
     * Validate the files of an admitted upload request and hand them to business logic.
     *
     * @param request the upload request
     * @return receipts of the stored files; fails with {@link UploadRejectedException} when
     *     any file or form limit is rejected
     */
    public Uni<List<StoredFile>> receiveUploads(UploadRequest request) {
        final var form = request.form();
        final var limits = formLimits.check(form, request.fileField(), request.maxFiles());
        if (limits instanceof ValidationVerdict.Rejected rejected) {
            LOG.warnv(
                    "File upload blocked: reason={0} caller={1} ip={2}: {3}",
                    rejected.reason(), caller(request), request.clientIp(), rejected.message());
            return Uni.createFrom().failure(new UploadRejectedException(rejected));
        }
        if (form.files().isEmpty()) {
            return Uni.createFrom().failure(new IllegalArgumentException("No file uploaded"));
        }

        for (final var file : form.files()) {
            final var verdict = pipeline.validate(file, form.files().size());
            if (verdict instanceof ValidationVerdict.Rejected rejected) {
                LOG.warnv(
                        "File upload blocked: {0} ({1}) reason={2} caller={3} ip={4}",
                        file.originalFilename(),
                        file.declaredMimeType(),
                        rejected.reason(),
                        caller(request),
                        request.clientIp());
                return Uni.createFrom().failure(new UploadRejectedException(rejected));
            }
        }
        return uploadHandler.accept(form.files(), request.callerIdentity());
    }

    private static String caller(UploadRequest request) {
        return request.callerIdentity() != null ? request.callerIdentity() : "anonymous";
    }
}
