package dockhand.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import dockhand.core.model.auth.AuthenticationFailure;
import dockhand.core.model.auth.PrincipalKind;
import dockhand.core.port.out.AuthMetrics;

/**
 * Records authentication and API key metrics using Micrometer.
 *
 * <p>All methods are no-ops when telemetry is disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code dockhand.auth.success.total} - Resolved principals by kind</li>
 *   <li>{@code dockhand.auth.failures.total} - Authentication failures by failure kind</li>
 *   <li>{@code dockhand.auth.denied.total} - Authorization denials by principal kind and reason</li>
 *   <li>{@code dockhand.apikeys.usage.recorded.total} - Usage increments applied</li>
 *   <li>{@code dockhand.apikeys.usage.failures.total} - Usage increments lost</li>
 *   <li>{@code dockhand.apikeys.usage.unconfirmed.total} - Usage writes that timed out</li>
 *   <li>{@code dockhand.apikeys.lifecycle.total} - Administrative key changes by action</li>
 * </ul>
 */
@ApplicationScoped
public class AuthMetricsRecorder implements AuthMetrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public AuthMetricsRecorder(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordAuthSuccess(PrincipalKind kind) {
        if (!enabled) {
            return;
        }

        Counter.builder("dockhand.auth.success.total")
                .description("Requests resolved to a principal")
                .tag("kind", tagValue(kind))
                .register(registry)
                .increment();
    }

    @Override
    public void recordAuthFailure(AuthenticationFailure failure) {
        if (!enabled) {
            return;
        }

        Counter.builder("dockhand.auth.failures.total")
                .description("Requests whose credential could not be resolved")
                .tag("failure", failure.code())
                .register(registry)
                .increment();
    }

    @Override
    public void recordAccessDenied(PrincipalKind kind, String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("dockhand.auth.denied.total")
                .description("Resolved principals denied by the authorization gate")
                .tag("kind", tagValue(kind))
                .tag("reason", reason != null ? reason : "unknown")
                .register(registry)
                .increment();
    }

    @Override
    public void recordUsageRecorded() {
        if (!enabled) {
            return;
        }

        Counter.builder("dockhand.apikeys.usage.recorded.total")
                .description("API key usage increments applied")
                .register(registry)
                .increment();
    }

    @Override
    public void recordUsageFailure() {
        if (!enabled) {
            return;
        }

        Counter.builder("dockhand.apikeys.usage.failures.total")
                .description("API key usage increments that could not be applied")
                .register(registry)
                .increment();
    }

    @Override
    public void recordUsageUnconfirmed() {
        if (!enabled) {
            return;
        }

        Counter.builder("dockhand.apikeys.usage.unconfirmed.total")
                .description("API key usage writes not confirmed within the write timeout")
                .register(registry)
                .increment();
    }

    @Override
    public void recordKeyLifecycle(String action) {
        if (!enabled) {
            return;
        }

        Counter.builder("dockhand.apikeys.lifecycle.total")
                .description("Administrative API key changes")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    private static String tagValue(PrincipalKind kind) {
        return kind == null ? "unknown" : kind.name().toLowerCase(java.util.Locale.ROOT);
    }
}
