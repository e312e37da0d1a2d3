package deskgate.support;

import java.util.Map;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * Stand-in application endpoints behind the gateway, available to tests only.
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
public class TestEndpoints {

    public record Credentials(String email, String password) {}

    @POST
    @Path("/auth/login")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response login(Credentials credentials) {
        if (credentials == null || !"correct-horse".equals(credentials.password())) {
            return Response.status(Response.Status.UNAUTHORIZED)
                    .entity(Map.of("message", "Invalid credentials"))
                    .build();
        }
        return Response.ok(Map.of("message", "Logged in")).build();
    }

    @POST
    @Path("/auth/forgot-password")
    public Response forgotPassword() {
        return Response.ok(Map.of("message", "Reset link sent")).build();
    }

    @GET
    @Path("/search")
    public Response search(@QueryParam("q") String query) {
        return Response.ok(Map.of("query", query == null ? "" : query)).build();
    }
}
