package dockhand.core.port.out;

import dockhand.core.model.auth.AuthenticationFailure;
import dockhand.core.model.auth.PrincipalKind;

/**
 * Port interface for recording authentication and key lifecycle metrics.
 */
public interface AuthMetrics {

    boolean isEnabled();

    void recordAuthSuccess(PrincipalKind kind);

    void recordAuthFailure(AuthenticationFailure failure);

    void recordAccessDenied(PrincipalKind kind, String reason);

    void recordUsageRecorded();

    void recordUsageFailure();

    /**
     * A usage write timed out. The increment may still have been applied.
     */
    void recordUsageUnconfirmed();

    /**
     * @param action one of {@code issued}, {@code activated}, {@code deactivated}, {@code deleted}
     */
    void recordKeyLifecycle(String action);
}
