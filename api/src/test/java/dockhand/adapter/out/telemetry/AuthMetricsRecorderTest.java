package dockhand.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import dockhand.core.model.auth.AuthenticationFailure;
import dockhand.core.model.auth.PrincipalKind;

@DisplayName("AuthMetricsRecorder")
class AuthMetricsRecorderTest {

    private SimpleMeterRegistry registry;
    private TelemetryConfig telemetryConfig;
    private TelemetryConfig.MetricsConfig metricsConfig;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        telemetryConfig = mock(TelemetryConfig.class);
        metricsConfig = mock(TelemetryConfig.MetricsConfig.class);
        when(telemetryConfig.metrics()).thenReturn(metricsConfig);
        when(telemetryConfig.enabled()).thenReturn(true);
        when(metricsConfig.enabled()).thenReturn(true);
    }

    @Nested
    @DisplayName("when enabled")
    class Enabled {

        @Test
        @DisplayName("should count failures by kind")
        void failures() {
            var metrics = new AuthMetricsRecorder(registry, telemetryConfig);

            metrics.recordAuthFailure(AuthenticationFailure.CREDENTIAL_EXPIRED);
            metrics.recordAuthFailure(AuthenticationFailure.CREDENTIAL_EXPIRED);

            assertEquals(
                    2.0,
                    registry.get("dockhand.auth.failures.total")
                            .tag("failure", "credential_expired")
                            .counter()
                            .count());
        }

        @Test
        @DisplayName("should count successes and denials by principal kind")
        void successAndDenials() {
            var metrics = new AuthMetricsRecorder(registry, telemetryConfig);

            metrics.recordAuthSuccess(PrincipalKind.MACHINE);
            metrics.recordAccessDenied(PrincipalKind.MACHINE, "scope_mismatch");

            assertEquals(
                    1.0,
                    registry.get("dockhand.auth.success.total").tag("kind", "machine").counter().count());
            assertEquals(
                    1.0,
                    registry.get("dockhand.auth.denied.total")
                            .tag("reason", "scope_mismatch")
                            .counter()
                            .count());
        }

        @Test
        @DisplayName("should count usage writes and lifecycle actions")
        void usageAndLifecycle() {
            var metrics = new AuthMetricsRecorder(registry, telemetryConfig);

            metrics.recordUsageRecorded();
            metrics.recordUsageFailure();
            metrics.recordUsageUnconfirmed();
            metrics.recordKeyLifecycle("deactivated");

            assertEquals(1.0, registry.get("dockhand.apikeys.usage.recorded.total").counter().count());
            assertEquals(1.0, registry.get("dockhand.apikeys.usage.failures.total").counter().count());
            assertEquals(1.0, registry.get("dockhand.apikeys.usage.unconfirmed.total").counter().count());
            assertEquals(
                    1.0,
                    registry.get("dockhand.apikeys.lifecycle.total")
                            .tag("action", "deactivated")
                            .counter()
                            .count());
        }
    }

    @Test
    @DisplayName("should record nothing when metrics are disabled")
    void disabled() {
        when(metricsConfig.enabled()).thenReturn(false);
        var metrics = new AuthMetricsRecorder(registry, telemetryConfig);

        metrics.recordAuthFailure(AuthenticationFailure.MISSING_CREDENTIAL);

        assertFalse(metrics.isEnabled());
        assertNull(registry.find("dockhand.auth.failures.total").counter());
    }

    @Test
    @DisplayName("should be enabled when telemetry and metrics are on")
    void enabled() {
        assertTrue(new AuthMetricsRecorder(registry, telemetryConfig).isEnabled());
    }
}
