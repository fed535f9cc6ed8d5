package dockhand.adapter.in.rest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import dockhand.adapter.in.auth.RouteGuard;
import dockhand.adapter.in.problem.AuthProblem;
import dockhand.core.model.auth.AuthScheme;
import dockhand.core.model.auth.Permissions;
import dockhand.core.model.auth.Principal;
import dockhand.core.model.auth.RouteRequirement;
import dockhand.core.model.auth.UserRole;
import dockhand.core.port.out.PackageDirectory;
import dockhand.core.service.auth.AuthorizationService;

/**
 * Partner-facing package endpoints.
 *
 * <p>Accepts either a partner API key or a staff session. Keys must hold the
 * route's permissions and be scoped to the courier that owns the package.
 */
@Path("/api/partner")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PartnerResource {

    private static final Logger LOG = Logger.getLogger(PartnerResource.class);

    private static final RouteRequirement PING = RouteRequirement.roles(UserRole.ADMIN, UserRole.WAREHOUSE_STAFF);
    private static final RouteRequirement READ_PACKAGE = PING.andPermissions(Permissions.PACKAGES_READ);
    private static final RouteRequirement WRITE_PACKAGE = PING.andPermissions(Permissions.PACKAGES_WRITE);

    private final RouteGuard guard;
    private final AuthorizationService authorization;
    private final PackageDirectory packages;

    @Inject
    public PartnerResource(RouteGuard guard, AuthorizationService authorization, PackageDirectory packages) {
        this.guard = guard;
        this.authorization = authorization;
        this.packages = packages;
    }

    /**
     * Connectivity check for partners configuring their side.
     */
    @GET
    @Path("/ping")
    public Uni<Map<String, Object>> ping(@Context HttpHeaders headers) {
        return guard.require(headers, AuthScheme.COMBINED, PING).map(principal -> {
            var body = new LinkedHashMap<String, Object>();
            body.put("status", "ok");
            body.put("principal", principal.kind().name().toLowerCase(java.util.Locale.ROOT));
            body.put("scope", principal.scope().toString());
            body.put("timestamp", Instant.now());
            return body;
        });
    }

    @GET
    @Path("/packages/{trackingNumber}")
    public Uni<Map<String, Object>> getPackage(
            @Context HttpHeaders headers, @PathParam("trackingNumber") String trackingNumber) {
        return authorizeForPackage(headers, trackingNumber, READ_PACKAGE).map(access -> {
            var body = new LinkedHashMap<String, Object>();
            body.put("trackingNumber", trackingNumber);
            body.put("courierCode", access.courierCode());
            return body;
        });
    }

    @POST
    @Path("/packages/{trackingNumber}")
    public Uni<Response> updatePackage(
            @Context HttpHeaders headers,
            @PathParam("trackingNumber") String trackingNumber,
            Map<String, Object> update) {
        return authorizeForPackage(headers, trackingNumber, WRITE_PACKAGE).map(access -> {
            LOG.infof(
                    "Package update accepted: trackingNumber=%s, by=%s, fields=%s",
                    trackingNumber,
                    access.principal().describe(),
                    update != null ? update.keySet() : "none");
            var body = new LinkedHashMap<String, Object>();
            body.put("trackingNumber", trackingNumber);
            body.put("status", "accepted");
            return Response.accepted(body).build();
        });
    }

    private Uni<PackageAccess> authorizeForPackage(
            HttpHeaders headers, String trackingNumber, RouteRequirement requirement) {
        return guard.resolve(headers, AuthScheme.COMBINED)
                .flatMap(principal -> packages.findCourierCode(trackingNumber).map(courier -> {
                    String courierCode =
                            courier.orElseThrow(() -> AuthProblem.resourceNotFound("Package", trackingNumber));
                    authorization.authorize(principal, requirement, courierCode);
                    return new PackageAccess(principal, courierCode);
                }));
    }

    private record PackageAccess(Principal principal, String courierCode) {}
}
