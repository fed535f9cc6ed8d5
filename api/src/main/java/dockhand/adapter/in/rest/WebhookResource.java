package dockhand.adapter.in.rest;

import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
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
import dockhand.adapter.in.dto.WebhookReceipt;
import dockhand.adapter.in.problem.AuthProblem;

/**
 * Inbound partner webhooks, authenticated by API key only.
 *
 * <p>Payload processing belongs to the package workflows; this endpoint
 * authenticates the sender and acknowledges receipt.
 */
@Path("/api/webhooks/partner")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class WebhookResource {

    private static final Logger LOG = Logger.getLogger(WebhookResource.class);

    static final Set<String> EVENTS = Set.of(
            "package-created",
            "package-updated",
            "package-delivered",
            "package-deleted",
            "manifest-created",
            "test");

    private final RouteGuard guard;

    @Inject
    public WebhookResource(RouteGuard guard) {
        this.guard = guard;
    }

    @POST
    @Path("/{event}")
    public Uni<Response> receive(
            @Context HttpHeaders headers, @PathParam("event") String event, Map<String, Object> payload) {
        return guard.webhook(headers).map(context -> {
            if (!EVENTS.contains(event)) {
                throw AuthProblem.resourceNotFound("Webhook event", event);
            }
            LOG.infof(
                    "Webhook received: event=%s, source=%s, keyId=%s, fields=%d",
                    event, context.source(), context.keyId(), payload != null ? payload.size() : 0);
            return Response.accepted(new WebhookReceipt(event, context.source(), context.validatedAt()))
                    .build();
        });
    }
}
