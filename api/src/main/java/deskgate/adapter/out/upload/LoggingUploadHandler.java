package deskgate.adapter.out.upload;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import io.quarkus.arc.DefaultBean;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import deskgate.core.model.upload.UploadCandidate;
import deskgate.core.port.out.AcceptedUploadHandler;

/**
 * Default hand-off for accepted uploads: logs them and returns a receipt.
 *
 * <p>Deployments that persist uploads provide their own {@link AcceptedUploadHandler} bean.
 */
@ApplicationScoped
@DefaultBean
public class LoggingUploadHandler implements AcceptedUploadHandler {

    private static final Logger LOG = Logger.getLogger(LoggingUploadHandler.class);

    @Override
    public Uni<List<StoredFile>> accept(List<UploadCandidate> files, String callerIdentity) {
        final var stored = files.stream()
                .map(file -> new StoredFile(file.originalFilename(), file.declaredMimeType(), file.length()))
                .toList();
        stored.forEach(file -> LOG.infov(
                "File uploaded: {0} ({1}, {2} bytes) by {3}",
                file.filename(), file.mimeType(), file.size(), callerIdentity != null ? callerIdentity : "anonymous"));
        return Uni.createFrom().item(stored);
    }
}
