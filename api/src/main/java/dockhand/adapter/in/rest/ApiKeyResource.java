package dockhand.adapter.in.rest;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;

import io.smallrye.mutiny.Uni;

import dockhand.adapter.in.auth.RouteGuard;
import dockhand.adapter.in.dto.ApiKeyListResponse;
import dockhand.adapter.in.dto.ApiKeyResponse;
import dockhand.adapter.in.dto.ConnectionInfoResponse;
import dockhand.adapter.in.dto.IssueApiKeyRequest;
import dockhand.adapter.in.dto.IssuedApiKeyResponse;
import dockhand.core.model.auth.ApiKeyDeletion;
import dockhand.core.model.auth.ApiKeyFilter;
import dockhand.core.model.auth.AuthScheme;
import dockhand.core.model.auth.RouteRequirement;
import dockhand.core.model.auth.UserRole;
import dockhand.core.port.in.ApiKeyManagement;

/**
 * REST resource for partner API key management.
 *
 * <p>Every endpoint requires a user session with the {@code admin} role. API keys
 * cannot manage other API keys.
 */
@Path("/api/admin/api-keys")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ApiKeyResource {

    private static final RouteRequirement ADMIN_ONLY = RouteRequirement.roles(UserRole.ADMIN);

    private final ApiKeyManagement apiKeyService;
    private final RouteGuard guard;

    @Inject
    public ApiKeyResource(ApiKeyManagement apiKeyService, RouteGuard guard) {
        this.apiKeyService = apiKeyService;
        this.guard = guard;
    }

    /**
     * Issue a new API key.
     *
     * <p>The raw key is only returned in the response to this request.
     * It cannot be retrieved later - only the hash is stored.
     */
    @POST
    public Uni<Response> issueKey(@Context HttpHeaders headers, IssueApiKeyRequest request) {
        return guard.require(headers, AuthScheme.SESSION, ADMIN_ONLY).flatMap(admin -> {
            if (request == null) {
                throw new IllegalArgumentException("Request body is required");
            }
            return apiKeyService.issue(admin.id(), request.toModel());
        }).map(result -> {
            var key = ApiKeyResponse.fromModel(result.key());
            var body = new IssuedApiKeyResponse(result.rawKey(), key, nextSteps(key));
            return Response.status(Response.Status.CREATED).entity(body).build();
        });
    }

    /**
     * Alias of {@link #issueKey} kept for existing admin tooling.
     */
    @POST
    @Path("/generate")
    public Uni<Response> generateKey(@Context HttpHeaders headers, IssueApiKeyRequest request) {
        return issueKey(headers, request);
    }

    @GET
    public Uni<ApiKeyListResponse> listKeys(
            @Context HttpHeaders headers,
            @QueryParam("courierCode") String courierCode,
            @QueryParam("warehouseId") String warehouseId,
            @QueryParam("active") Boolean active) {
        var filter = new ApiKeyFilter(blankToNull(courierCode), blankToNull(warehouseId), active);
        return guard.require(headers, AuthScheme.SESSION, ADMIN_ONLY)
                .flatMap(admin -> apiKeyService.list(filter))
                .map(keys -> ApiKeyListResponse.of(
                        keys.stream().map(ApiKeyResponse::fromModel).toList()));
    }

    /**
     * Integration details for configuring the partner portal. Contains no key material.
     */
    @GET
    @Path("/info")
    public Uni<ConnectionInfoResponse> connectionInfo(@Context HttpHeaders headers, @Context UriInfo uriInfo) {
        String requestBase = uriInfo.getBaseUri().toString();
        return guard.require(headers, AuthScheme.SESSION, ADMIN_ONLY)
                .flatMap(admin -> apiKeyService.connectionInfo(requestBase))
                .map(ConnectionInfoResponse::fromModel);
    }

    @GET
    @Path("/{keyId}")
    public Uni<ApiKeyResponse> getKey(@Context HttpHeaders headers, @PathParam("keyId") String keyId) {
        return guard.require(headers, AuthScheme.SESSION, ADMIN_ONLY)
                .flatMap(admin -> apiKeyService.get(keyId))
                .map(ApiKeyResponse::fromModel);
    }

    /**
     * Deactivate a key. Idempotent; the key can be re-activated later.
     */
    @PUT
    @Path("/{keyId}/deactivate")
    public Uni<ApiKeyResponse> deactivateKey(@Context HttpHeaders headers, @PathParam("keyId") String keyId) {
        return guard.require(headers, AuthScheme.SESSION, ADMIN_ONLY)
                .flatMap(admin -> apiKeyService.deactivate(keyId))
                .map(ApiKeyResponse::fromModel);
    }

    @PUT
    @Path("/{keyId}/activate")
    public Uni<ApiKeyResponse> activateKey(@Context HttpHeaders headers, @PathParam("keyId") String keyId) {
        return guard.require(headers, AuthScheme.SESSION, ADMIN_ONLY)
                .flatMap(admin -> apiKeyService.activate(keyId))
                .map(ApiKeyResponse::fromModel);
    }

    /**
     * Permanently delete a key. Its value is never valid again.
     */
    @DELETE
    @Path("/{keyId}")
    public Uni<ApiKeyDeletion> deleteKey(@Context HttpHeaders headers, @PathParam("keyId") String keyId) {
        return guard.require(headers, AuthScheme.SESSION, ADMIN_ONLY).flatMap(admin -> apiKeyService.delete(keyId));
    }

    private static List<String> nextSteps(ApiKeyResponse key) {
        return List.of(
                "Store this key now. It will not be shown again.",
                "Enter the key in the partner portal for " + scopeLabel(key) + ".",
                "Send it in the X-API-Key header on every partner request.",
                "Use GET /api/admin/api-keys/info for the endpoint and webhook URLs.");
    }

    private static String scopeLabel(ApiKeyResponse key) {
        if (key.courierCode() != null) {
            return "courier " + key.courierCode();
        }
        return "warehouse " + key.warehouseId();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
