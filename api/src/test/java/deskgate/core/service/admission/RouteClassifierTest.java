package deskgate.core.service.admission;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import deskgate.core.model.admission.RouteClass;

@DisplayName("RouteClassifier")
class RouteClassifierTest {

    private RouteClassifier classifier;

    @BeforeEach
    void setUp() {
        var rules = new ArrayList<RouteClassifier.RouteRule>();
        for (var routeClass : RouteClass.values()) {
            rules.add(RouteClassifier.reference(routeClass));
        }
        classifier = new RouteClassifier(new GlobPatternMatcher(), rules);
    }

    @Nested
    @DisplayName("Reference routing table")
    class ReferenceTableTests {

        @Test
        @DisplayName("should classify credential endpoints as authentication")
        void shouldClassifyAuthentication() {
            assertEquals(Optional.of(RouteClass.AUTHENTICATION), classifier.classify("POST", "/api/auth/login"));
            assertEquals(Optional.of(RouteClass.AUTHENTICATION), classifier.classify("post", "/api/auth/register"));
        }

        @Test
        @DisplayName("should classify password reset as strict")
        void shouldClassifyStrict() {
            assertEquals(Optional.of(RouteClass.STRICT), classifier.classify("POST", "/api/auth/forgot-password"));
        }

        @Test
        @DisplayName("should classify upload endpoints as upload")
        void shouldClassifyUpload() {
            assertEquals(Optional.of(RouteClass.UPLOAD), classifier.classify("POST", "/api/files/upload"));
            assertEquals(Optional.of(RouteClass.UPLOAD), classifier.classify("POST", "/api/files/upload-multiple"));
        }

        @Test
        @DisplayName("should classify search with and without sub-paths or query")
        void shouldClassifySearch() {
            assertEquals(Optional.of(RouteClass.SEARCH), classifier.classify("GET", "/api/search"));
            assertEquals(Optional.of(RouteClass.SEARCH), classifier.classify("GET", "/api/search/users/recent"));
            assertEquals(Optional.of(RouteClass.SEARCH), classifier.classify("GET", "/api/search?q=x"));
        }

        @Test
        @DisplayName("should fall back to general for other API paths and methods")
        void shouldFallBackToGeneral() {
            assertEquals(Optional.of(RouteClass.GENERAL), classifier.classify("GET", "/api/auth/login"));
            assertEquals(Optional.of(RouteClass.GENERAL), classifier.classify("DELETE", "/api/items/7"));
        }

        @Test
        @DisplayName("should leave non-API paths unlimited")
        void shouldLeaveOtherPathsUnlimited() {
            assertTrue(classifier.classify("GET", "/q/health").isEmpty());
            assertTrue(classifier.classify("GET", "/").isEmpty());
        }
    }

    @Test
    @DisplayName("should let the first matching rule win")
    void shouldPreferFirstMatch() {
        var custom = new RouteClassifier(
                new GlobPatternMatcher(),
                List.of(
                        new RouteClassifier.RouteRule(RouteClass.STRICT, Set.of(), List.of("/api/admin/**")),
                        new RouteClassifier.RouteRule(RouteClass.GENERAL, Set.of(), List.of("/api/**"))));

        assertEquals(Optional.of(RouteClass.STRICT), custom.classify("GET", "/api/admin/users"));
        assertEquals(Optional.of(RouteClass.GENERAL), custom.classify("GET", "/api/users"));
    }
}
