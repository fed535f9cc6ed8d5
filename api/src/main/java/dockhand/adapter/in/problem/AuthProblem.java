package dockhand.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import dockhand.core.model.auth.AccountInactiveException;
import dockhand.core.model.auth.AuthenticationException;
import dockhand.core.model.auth.ForbiddenException;

/**
 * RFC 7807 Problem Details factory for authentication and key management errors.
 *
 * <p>Every problem carries enough detail for the caller to fix the request
 * without exposing key material.
 */
public final class AuthProblem {

    private AuthProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Authentication/Authorization Errors ==========

    public static HttpProblem unauthorized(AuthenticationException e) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(e.getMessage())
                .with("failure", e.failure().code())
                .with("hint", e.hint())
                .build();
    }

    public static HttpProblem forbidden(ForbiddenException e) {
        return HttpProblem.builder()
                .withTitle(e.kind() == ForbiddenException.Kind.SCOPE_MISMATCH ? "Scope Mismatch" : "Forbidden")
                .withStatus(Status.FORBIDDEN)
                .withDetail(e.getMessage())
                .with("kind", e.kind().code())
                .with("required", e.required())
                .with("actual", e.actual())
                .build();
    }

    public static HttpProblem accountInactive(AccountInactiveException e) {
        return HttpProblem.builder()
                .withTitle("Account Inactive")
                .withStatus(Status.FORBIDDEN)
                .withDetail(e.getMessage())
                .with("kind", "account_inactive")
                .with("status", e.status().name().toLowerCase(java.util.Locale.ROOT))
                .build();
    }

    // ========== Not Found Errors ==========

    public static HttpProblem resourceNotFound(String resourceType, String resourceId) {
        return HttpProblem.builder()
                .withTitle("%s Not Found".formatted(resourceType))
                .withStatus(Status.NOT_FOUND)
                .withDetail("%s not found: %s".formatted(resourceType, resourceId))
                .build();
    }

    // ========== Bad Request Errors ==========

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem invalidScope(String detail) {
        return HttpProblem.builder()
                .withTitle("Invalid Scope")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    // ========== Conflict Errors ==========

    public static HttpProblem conflict(String detail) {
        return HttpProblem.builder()
                .withTitle("Conflict")
                .withStatus(Status.CONFLICT)
                .withDetail(detail)
                .build();
    }
}
