package deskgate.adapter.in.rest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;

import io.smallrye.common.annotation.Blocking;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.resteasy.reactive.server.multipart.FormValue;
import org.jboss.resteasy.reactive.server.multipart.MultipartFormDataInput;

import deskgate.adapter.in.dto.UploadResponse;
import deskgate.core.config.UploadConfig;
import deskgate.core.model.upload.UploadCandidate;
import deskgate.core.model.upload.UploadForm;
import deskgate.core.service.gateway.RequestGateway;
import deskgate.system.filter.ClientIpResolver;

/**
 * REST resource for file uploads.
 *
 * <p>Admission has already run by the time a request gets here. This adapter turns the
 * multipart body into an {@link UploadForm} and delegates validation and hand-off to
 * {@link RequestGateway}.
 */
@Path("/api/files")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.MULTIPART_FORM_DATA)
public class FileUploadResource {

    static final String SINGLE_FIELD = "file";
    static final String MULTIPLE_FIELD = "files";

    private final RequestGateway gateway;
    private final ClientIpResolver ipResolver;
    private final int maxFiles;

    @Inject
    public FileUploadResource(RequestGateway gateway, ClientIpResolver ipResolver, UploadConfig config) {
        this.gateway = gateway;
        this.ipResolver = ipResolver;
        this.maxFiles = config.maxFiles();
    }

    @POST
    @Path("/upload")
    @Blocking
    public Uni<Response> upload(
            MultipartFormDataInput input,
            @Context SecurityContext security,
            @Context HttpHeaders headers,
            @Context HttpServerRequest request) {
        return receive(input, SINGLE_FIELD, 1, security, headers, request);
    }

    @POST
    @Path("/upload-multiple")
    @Blocking
    public Uni<Response> uploadMultiple(
            MultipartFormDataInput input,
            @Context SecurityContext security,
            @Context HttpHeaders headers,
            @Context HttpServerRequest request) {
        return receive(input, MULTIPLE_FIELD, maxFiles, security, headers, request);
    }

    private Uni<Response> receive(
            MultipartFormDataInput input,
            String fileField,
            int routeMaxFiles,
            SecurityContext security,
            HttpHeaders headers,
            HttpServerRequest request) {
        final var form = toForm(input);
        final var caller = security != null && security.getUserPrincipal() != null
                ? security.getUserPrincipal().getName()
                : null;
        final var uploadRequest = new RequestGateway.UploadRequest(
                form, fileField, routeMaxFiles, caller, ipResolver.resolve(headers::getHeaderString, request));

        return gateway.receiveUploads(uploadRequest)
                .map(stored -> Response.status(Response.Status.CREATED)
                        .entity(UploadResponse.fromModel(stored))
                        .build());
    }

    static UploadForm toForm(MultipartFormDataInput input) {
        final var files = new ArrayList<UploadCandidate>();
        final var fields = new LinkedHashMap<String, List<String>>();
        if (input == null) {
            return new UploadForm(files, fields);
        }
        for (final var entry : input.getValues().entrySet()) {
            for (final var value : entry.getValue()) {
                if (value.isFileItem()) {
                    files.add(toCandidate(entry.getKey(), value));
                } else {
                    fields.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).add(value.getValue());
                }
            }
        }
        return new UploadForm(files, fields);
    }

    private static UploadCandidate toCandidate(String fieldName, FormValue value) {
        final byte[] content;
        try (var in = value.getFileItem().getInputStream()) {
            content = in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read uploaded file", e);
        }
        final var partHeaders = value.getHeaders();
        final var contentType = partHeaders != null ? partHeaders.getFirst(HttpHeaders.CONTENT_TYPE) : null;
        return new UploadCandidate(
                fieldName, content, mimeTypeOf(contentType), value.getFileName(), declaredSize(value, content));
    }

    private static String mimeTypeOf(String contentType) {
        if (contentType == null) {
            return "application/octet-stream";
        }
        final var semicolon = contentType.indexOf(';');
        return (semicolon >= 0 ? contentType.substring(0, semicolon) : contentType).trim();
    }

    /**
     * The part's own Content-Length when it sent one, otherwise the bytes received.
     */
    private static long declaredSize(FormValue value, byte[] content) {
        final var partHeaders = value.getHeaders();
        final var declared = partHeaders != null ? partHeaders.getFirst(HttpHeaders.CONTENT_LENGTH) : null;
        if (declared != null) {
            try {
                return Long.parseLong(declared.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid Content-Length on part " + value.getFileName(), e);
            }
        }
        return content.length;
    }
}
