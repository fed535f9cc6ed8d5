package dockhand.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import dockhand.core.config.ApiKeyConfig;
import dockhand.core.model.auth.AccountInactiveException;
import dockhand.core.model.auth.ApiKeyNotFoundException;
import dockhand.core.model.auth.AuthenticationException;
import dockhand.core.model.auth.DuplicateKeyException;
import dockhand.core.model.auth.ForbiddenException;
import dockhand.core.model.auth.InvalidScopeException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>These mappers prevent domain exceptions from returning 500 Internal Server Error
 * when a more appropriate status code should be used.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    private final String challenge;

    @Inject
    public GlobalExceptionMappers(ApiKeyConfig apiKeyConfig) {
        this.challenge = "Bearer realm=\"dockhand\", ApiKey realm=\"dockhand\", header=\"" + apiKeyConfig.header()
                + "\"";
    }

    @ServerExceptionMapper
    public Response mapAuthenticationException(AuthenticationException e) {
        LOG.debugv("Authentication failed ({0}): {1}", e.failure().code(), e.getMessage());
        HttpProblem problem = AuthProblem.unauthorized(e);
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .header("WWW-Authenticate", challenge)
                .entity(problem)
                .build();
    }

    @ServerExceptionMapper
    public Response mapAccountInactiveException(AccountInactiveException e) {
        return toResponse(AuthProblem.accountInactive(e));
    }

    @ServerExceptionMapper
    public Response mapForbiddenException(ForbiddenException e) {
        return toResponse(AuthProblem.forbidden(e));
    }

    @ServerExceptionMapper
    public Response mapApiKeyNotFoundException(ApiKeyNotFoundException e) {
        return toResponse(AuthProblem.resourceNotFound("API key", e.keyId()));
    }

    @ServerExceptionMapper
    public Response mapInvalidScopeException(InvalidScopeException e) {
        return toResponse(AuthProblem.invalidScope(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapDuplicateKeyException(DuplicateKeyException e) {
        LOG.warnv("API key issuance collided: {0}", e.getMessage());
        return toResponse(AuthProblem.conflict(e.getMessage()));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(AuthProblem.validationError(e.getMessage()));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
