package deskgate.system.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.function.UnaryOperator;

import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.net.SocketAddress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ClientIpResolver")
class ClientIpResolverTest {

    private static UnaryOperator<String> headers(Map<String, String> values) {
        return values::get;
    }

    private static HttpServerRequest socket(String ip) {
        var request = mock(HttpServerRequest.class);
        var address = mock(SocketAddress.class);
        when(address.hostAddress()).thenReturn(ip);
        when(request.remoteAddress()).thenReturn(address);
        return request;
    }

    @Nested
    @DisplayName("Trusting forwarding headers")
    class TrustedTests {

        private final ClientIpResolver resolver = new ClientIpResolver(true);

        @Test
        @DisplayName("should prefer the Forwarded header")
        void shouldPreferForwarded() {
            var ip = resolver.resolve(
                    headers(Map.of("Forwarded", "for=203.0.113.7;proto=https", "X-Forwarded-For", "198.51.100.1")),
                    socket("10.0.0.1"));

            assertEquals("203.0.113.7", ip);
        }

        @Test
        @DisplayName("should take the first X-Forwarded-For entry")
        void shouldUseFirstForwardedFor() {
            var ip = resolver.resolve(
                    headers(Map.of("X-Forwarded-For", " 198.51.100.1 , 10.0.0.2")), socket("10.0.0.1"));

            assertEquals("198.51.100.1", ip);
        }

        @Test
        @DisplayName("should fall back to the socket address")
        void shouldFallBackToSocket() {
            assertEquals("10.0.0.1", resolver.resolve(headers(Map.of()), socket("10.0.0.1")));
        }
    }

    @Test
    @DisplayName("should ignore forwarding headers unless trusted")
    void shouldIgnoreUntrustedHeaders() {
        var resolver = new ClientIpResolver(false);

        var ip = resolver.resolve(headers(Map.of("X-Forwarded-For", "198.51.100.1")), socket("10.0.0.1"));

        assertEquals("10.0.0.1", ip);
    }

    @Test
    @DisplayName("should return null when nothing is known")
    void shouldReturnNullWhenUnknown() {
        assertNull(new ClientIpResolver(false).resolve(headers(Map.of()), null));
    }

    @Test
    @DisplayName("should parse quoted, ported and IPv6 Forwarded values")
    void shouldParseForwardedVariants() {
        assertEquals("192.0.2.60", ClientIpResolver.parseForwardedFor("for=\"192.0.2.60:4711\""));
        assertEquals("2001:db8:cafe::17", ClientIpResolver.parseForwardedFor("For=\"[2001:db8:cafe::17]:4711\""));
        assertEquals("192.0.2.43", ClientIpResolver.parseForwardedFor("for=192.0.2.43, for=198.51.100.17"));
        assertNull(ClientIpResolver.parseForwardedFor("proto=http;by=203.0.113.43"));
    }
}
