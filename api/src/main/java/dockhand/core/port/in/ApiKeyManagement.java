package dockhand.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import dockhand.core.model.auth.ApiKeyDeletion;
import dockhand.core.model.auth.ApiKeyFilter;
import dockhand.core.model.auth.ApiKeyIssueRequest;
import dockhand.core.model.auth.ApiKeyIssueResult;
import dockhand.core.model.auth.ApiKeyView;
import dockhand.core.model.auth.ConnectionInfo;

/**
 * Port for the administrative API key lifecycle.
 *
 * <p>The raw key is returned only by {@link #issue}. Every other operation returns
 * {@link ApiKeyView}s, which carry no secret material.
 */
public interface ApiKeyManagement {

    /**
     * Generates and stores a new key.
     *
     * @param ownerRef id of the admin issuing the key
     * @param request  scope, permissions, lifetime and descriptive fields
     * @return Uni with the raw key (shown once) and the stored key
     * @throws dockhand.core.model.auth.InvalidScopeException if the scope does not validate
     * @throws dockhand.core.model.auth.DuplicateKeyException on a generated-value collision
     * @throws IllegalArgumentException if permissions, lifetime or rate limits are invalid
     */
    Uni<ApiKeyIssueResult> issue(String ownerRef, ApiKeyIssueRequest request);

    /**
     * Lists keys matching the filter, newest first.
     */
    Uni<List<ApiKeyView>> list(ApiKeyFilter filter);

    /**
     * Reads one key.
     *
     * @throws dockhand.core.model.auth.ApiKeyNotFoundException if no such key
     */
    Uni<ApiKeyView> get(String keyId);

    /**
     * Marks a key inactive. Deactivating an inactive key succeeds.
     *
     * @throws dockhand.core.model.auth.ApiKeyNotFoundException if no such key
     */
    Uni<ApiKeyView> deactivate(String keyId);

    /**
     * Marks a key active. An expired key stays unusable until its expiry is extended.
     *
     * @throws dockhand.core.model.auth.ApiKeyNotFoundException if no such key
     */
    Uni<ApiKeyView> activate(String keyId);

    /**
     * Permanently removes a key.
     *
     * @throws dockhand.core.model.auth.ApiKeyNotFoundException if no such key
     */
    Uni<ApiKeyDeletion> delete(String keyId);

    /**
     * Non-secret metadata for configuring the partner's portal.
     *
     * @param baseUrl the public base URL to prefix endpoint paths with
     */
    Uni<ConnectionInfo> connectionInfo(String baseUrl);
}
