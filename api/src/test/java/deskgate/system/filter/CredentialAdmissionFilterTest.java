package deskgate.system.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.UriInfo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import deskgate.core.config.AdmissionConfig;
import deskgate.core.model.admission.AdmissionDecision;
import deskgate.core.model.admission.RouteClass;
import deskgate.core.service.gateway.RequestGateway;

@DisplayName("CredentialAdmissionFilter")
class CredentialAdmissionFilterTest {

    private RequestGateway gateway;
    private RequestDescriptors descriptors;
    private CredentialAdmissionFilter filter;

    @BeforeEach
    void setUp() {
        gateway = mock(RequestGateway.class);
        descriptors = mock(RequestDescriptors.class);
        var config = mock(AdmissionConfig.class);
        when(config.identifierField()).thenReturn("email");
        filter = new CredentialAdmissionFilter(gateway, descriptors, new ObjectMapper(), config);
    }

    @Nested
    @DisplayName("Identifier extraction")
    class ExtractionTests {

        @Test
        @DisplayName("should read a field from a form-encoded body")
        void shouldReadFormField() {
            assertEquals(
                    Optional.of("jane+1@example.com"),
                    CredentialAdmissionFilter.formField("password=x&email=jane%2B1%40example.com", "email"));
            assertEquals(Optional.empty(), CredentialAdmissionFilter.formField("password=x", "email"));
            assertEquals(Optional.empty(), CredentialAdmissionFilter.formField("", "email"));
        }

        @Test
        @DisplayName("should skip form pairs with malformed escapes")
        void shouldSkipMalformedFormPairs() {
            assertEquals(
                    Optional.of("a@b.c"), CredentialAdmissionFilter.formField("%zz=1&email=a@b.c", "email"));
            assertEquals(Optional.empty(), CredentialAdmissionFilter.formField("email=%zz", "email"));
            assertEquals(Optional.empty(), CredentialAdmissionFilter.formField("email=100%", "email"));
        }

        @Test
        @DisplayName("should read a text field from a JSON body")
        void shouldReadJsonField() {
            assertEquals(
                    Optional.of("jane@example.com"),
                    filter.jsonField(bytes("{\"email\":\"jane@example.com\",\"password\":\"x\"}"), "email"));
            assertEquals(Optional.empty(), filter.jsonField(bytes("{\"email\":42}"), "email"));
            assertEquals(Optional.empty(), filter.jsonField(bytes("not json"), "email"));
        }
    }

    @Test
    @DisplayName("should admit authentication attempts with the submitted identifier and restore the body")
    void shouldAdmitWithIdentifier() {
        var requestContext =
                authenticationRequest(bytes("{\"email\":\"jane@example.com\"}"), MediaType.APPLICATION_JSON_TYPE);
        when(gateway.admit(any())).thenReturn(Uni.createFrom().item(AdmissionDecision.unlimited()));

        var response = filter.filter(requestContext, null).await().atMost(Duration.ofSeconds(1));

        assertNull(response);
        verify(descriptors)
                .describe(requestContext, null, RouteClass.AUTHENTICATION, Map.of("email", "jane@example.com"));
        verify(requestContext).setEntityStream(any());
    }

    @Test
    @DisplayName("should still admit an attempt whose form body cannot be decoded")
    void shouldAdmitMalformedFormBody() {
        var requestContext = authenticationRequest(bytes("email=%zz"), MediaType.APPLICATION_FORM_URLENCODED_TYPE);
        when(gateway.admit(any())).thenReturn(Uni.createFrom().item(AdmissionDecision.unlimited()));

        var response = filter.filter(requestContext, null).await().atMost(Duration.ofSeconds(1));

        assertNull(response);
        verify(descriptors).describe(requestContext, null, RouteClass.AUTHENTICATION, Map.of());
        verify(gateway).admit(any());
    }

    private ContainerRequestContext authenticationRequest(byte[] body, MediaType mediaType) {
        var requestContext = mock(ContainerRequestContext.class);
        var uriInfo = mock(UriInfo.class);
        when(uriInfo.getPath()).thenReturn("/api/auth/login");
        when(requestContext.getUriInfo()).thenReturn(uriInfo);
        when(requestContext.getMethod()).thenReturn("POST");
        when(requestContext.hasEntity()).thenReturn(true);
        when(requestContext.getEntityStream()).thenReturn(new ByteArrayInputStream(body));
        when(requestContext.getMediaType()).thenReturn(mediaType);
        when(gateway.classify("POST", "/api/auth/login")).thenReturn(Optional.of(RouteClass.AUTHENTICATION));
        return requestContext;
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
