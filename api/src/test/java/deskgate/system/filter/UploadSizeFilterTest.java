package deskgate.system.filter;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Optional;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.UriInfo;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import deskgate.core.model.admission.RouteClass;
import deskgate.core.model.upload.RejectionReason;
import deskgate.core.service.gateway.RequestGateway;
import deskgate.core.service.upload.FormLimits;
import deskgate.core.service.upload.UploadRejectedException;
import deskgate.core.service.upload.UploadRulesProducer;

@DisplayName("UploadSizeFilter")
class UploadSizeFilterTest {

    private RequestGateway gateway;
    private FormLimits formLimits;
    private ContainerRequestContext requestContext;
    private UploadSizeFilter filter;

    @BeforeEach
    void setUp() {
        gateway = mock(RequestGateway.class);
        formLimits = new FormLimits(UploadRulesProducer.referenceRules());
        requestContext = mock(ContainerRequestContext.class);
        var uriInfo = mock(UriInfo.class);
        when(uriInfo.getPath()).thenReturn("/api/files/upload");
        when(requestContext.getUriInfo()).thenReturn(uriInfo);
        when(requestContext.getMethod()).thenReturn("POST");
        when(gateway.classify("POST", "/api/files/upload")).thenReturn(Optional.of(RouteClass.UPLOAD));
        filter = new UploadSizeFilter(gateway, formLimits);
    }

    @Test
    @DisplayName("should refuse an upload whose declared length no valid upload could reach")
    void shouldRejectOversizedDeclaredLength() {
        when(requestContext.getHeaderString(HttpHeaders.CONTENT_LENGTH))
                .thenReturn(String.valueOf(formLimits.maxRequestBytes() + 1));

        var error = assertThrows(UploadRejectedException.class, () -> filter.filter(requestContext));

        assertEquals(RejectionReason.FILE_TOO_LARGE, error.getReason());
    }

    @Test
    @DisplayName("should let uploads within the limit through to parsing")
    void shouldPassUploadWithinLimit() {
        when(requestContext.getHeaderString(HttpHeaders.CONTENT_LENGTH)).thenReturn("2048");

        assertDoesNotThrow(() -> filter.filter(requestContext));
    }

    @Test
    @DisplayName("should leave bodies without a usable length to the form limits")
    void shouldPassUndeclaredLength() {
        when(requestContext.getHeaderString(HttpHeaders.CONTENT_LENGTH)).thenReturn("chunked");

        assertDoesNotThrow(() -> filter.filter(requestContext));
        assertEquals(-1, UploadSizeFilter.parseContentLength(null));
    }

    @Test
    @DisplayName("should ignore routes outside the upload class")
    void shouldIgnoreOtherRoutes() {
        when(gateway.classify("POST", "/api/files/upload")).thenReturn(Optional.of(RouteClass.GENERAL));
        when(requestContext.getHeaderString(HttpHeaders.CONTENT_LENGTH)).thenReturn(String.valueOf(Long.MAX_VALUE));

        assertDoesNotThrow(() -> filter.filter(requestContext));
    }
}
