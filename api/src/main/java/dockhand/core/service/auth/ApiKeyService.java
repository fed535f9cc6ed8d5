package dockhand.core.service.auth;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import dockhand.core.config.ApiKeyConfig;
import dockhand.core.config.IntegrationConfig;
import dockhand.core.model.auth.ApiKeyDeletion;
import dockhand.core.model.auth.ApiKeyFilter;
import dockhand.core.model.auth.ApiKeyIssueRequest;
import dockhand.core.model.auth.ApiKeyIssueResult;
import dockhand.core.model.auth.ApiKeyNotFoundException;
import dockhand.core.model.auth.ApiKeyRecord;
import dockhand.core.model.auth.ApiKeyView;
import dockhand.core.model.auth.ConnectionInfo;
import dockhand.core.model.auth.CredentialScope;
import dockhand.core.model.auth.DuplicateKeyException;
import dockhand.core.model.auth.InvalidScopeException;
import dockhand.core.port.in.ApiKeyManagement;
import dockhand.core.port.out.ApiKeyRepository;
import dockhand.core.port.out.AuthMetrics;

/**
 * Issues, lists, toggles and deletes API keys.
 *
 * <p>Keys are stored as SHA-256 hashes; the raw value is only returned once, by
 * {@link #issue}. All read paths return {@link ApiKeyView}s.
 */
@ApplicationScoped
public class ApiKeyService implements ApiKeyManagement {

    private static final Logger LOG = Logger.getLogger(ApiKeyService.class);

    static final String KEY_PREFIX = "dk_";
    static final int KEY_BODY_LENGTH = 45;
    static final Pattern KEY_PATTERN = Pattern.compile("^dk_[A-Za-z0-9]{45}$");

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final Pattern PERMISSION_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9_.:-]{0,49}$");
    private static final int MAX_NAME_LENGTH = 100;
    private static final int MAX_DESCRIPTION_LENGTH = 500;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final ApiKeyRepository repository;
    private final ApiKeyConfig config;
    private final IntegrationConfig integrationConfig;
    private final AuthMetrics metrics;
    private final Pattern courierCodePattern;
    private final Pattern warehouseIdPattern;

    @Inject
    public ApiKeyService(
            ApiKeyRepository repository,
            ApiKeyConfig config,
            IntegrationConfig integrationConfig,
            AuthMetrics metrics) {
        this.repository = repository;
        this.config = config;
        this.integrationConfig = integrationConfig;
        this.metrics = metrics;
        this.courierCodePattern = Pattern.compile(config.courierCodePattern());
        this.warehouseIdPattern = Pattern.compile(config.warehouseIdPattern());
    }

    @Override
    public Uni<ApiKeyIssueResult> issue(String ownerRef, ApiKeyIssueRequest request) {
        if (ownerRef == null || ownerRef.isBlank()) {
            throw new IllegalArgumentException("Issuing user is required");
        }
        if (request == null) {
            throw new IllegalArgumentException("Issue request is required");
        }

        CredentialScope scope = validateScope(request.scope());
        Set<String> permissions = validatePermissions(request.permissions());
        Duration ttl = resolveTtl(request.expiresInDays());
        String name = resolveName(request.name(), scope);
        String description = trimToLength(request.description(), MAX_DESCRIPTION_LENGTH, "description");

        Instant now = Instant.now();
        String rawKey = generateKey();

        var apiKey = ApiKeyRecord.builder(UUID.randomUUID().toString(), ApiKeyHashing.hash(rawKey))
                .name(name)
                .description(description)
                .ownerRef(ownerRef)
                .scope(scope)
                .permissions(permissions)
                .active(true)
                .expiresAt(ttl != null ? now.plus(ttl) : null)
                .usageCount(0)
                .rateLimit(request.rateLimit())
                .createdAt(now)
                .updatedAt(now)
                .build();

        return repository.insert(apiKey).map(inserted -> {
            if (!inserted) {
                throw new DuplicateKeyException("Generated API key collided with an existing key; retry issuance");
            }
            metrics.recordKeyLifecycle("issued");
            LOG.infof(
                    "API key issued: id=%s, scope=%s, permissions=%s, expiresAt=%s, issuedBy=%s",
                    apiKey.id(), scope, permissions, apiKey.expiresAt(), ownerRef);
            return new ApiKeyIssueResult(rawKey, ApiKeyView.of(apiKey, now));
        });
    }

    @Override
    public Uni<List<ApiKeyView>> list(ApiKeyFilter filter) {
        ApiKeyFilter effective = filter != null ? filter : ApiKeyFilter.all();
        return repository.findAll().map(keys -> {
            Instant now = Instant.now();
            return keys.stream()
                    .filter(effective::matches)
                    .sorted(Comparator.comparing(ApiKeyRecord::createdAt).reversed())
                    .map(key -> ApiKeyView.of(key, now))
                    .toList();
        });
    }

    @Override
    public Uni<ApiKeyView> get(String keyId) {
        return repository
                .findById(keyId)
                .map(opt -> opt.map(key -> ApiKeyView.of(key, Instant.now()))
                        .orElseThrow(() -> new ApiKeyNotFoundException(keyId)));
    }

    @Override
    public Uni<ApiKeyView> deactivate(String keyId) {
        return setActive(keyId, false, "deactivated");
    }

    @Override
    public Uni<ApiKeyView> activate(String keyId) {
        return setActive(keyId, true, "activated");
    }

    private Uni<ApiKeyView> setActive(String keyId, boolean active, String action) {
        Instant now = Instant.now();
        return repository.setActive(keyId, active, now).map(opt -> {
            ApiKeyRecord key = opt.orElseThrow(() -> new ApiKeyNotFoundException(keyId));
            metrics.recordKeyLifecycle(action);
            LOG.infof("API key %s: id=%s, scope=%s", action, keyId, key.scope());
            if (active && key.isExpired(now)) {
                LOG.infof("API key %s is active but expired at %s; it stays unusable", keyId, key.expiresAt());
            }
            return ApiKeyView.of(key, now);
        });
    }

    @Override
    public Uni<ApiKeyDeletion> delete(String keyId) {
        return repository.delete(keyId).map(opt -> {
            ApiKeyRecord key = opt.orElseThrow(() -> new ApiKeyNotFoundException(keyId));
            metrics.recordKeyLifecycle("deleted");
            LOG.infof("API key permanently deleted: id=%s, scope=%s", keyId, key.scope());
            return new ApiKeyDeletion(key.id(), key.scope().courierCode());
        });
    }

    @Override
    public Uni<ConnectionInfo> connectionInfo(String baseUrl) {
        String base = stripTrailingSlash(integrationConfig.baseUrl().orElse(baseUrl));
        return repository.findAll().map(keys -> {
            Instant now = Instant.now();
            List<ApiKeyView> usable = keys.stream()
                    .filter(key -> key.canUse(now))
                    .sorted(Comparator.comparing(ApiKeyRecord::createdAt).reversed())
                    .map(key -> ApiKeyView.of(key, now))
                    .toList();

            List<String> headers = new ArrayList<>();
            headers.add(config.header());
            headers.addAll(config.headerAliases());

            return new ConnectionInfo(
                    integrationConfig.partnerName(),
                    integrationConfig.portalUrl().orElse(null),
                    base,
                    List.copyOf(headers),
                    absolute(base, integrationConfig.endpoints()),
                    absolute(base, integrationConfig.webhooks()),
                    usable.size(),
                    usable);
        });
    }

    /**
     * Generates a random key of fixed length from an alphanumeric alphabet.
     *
     * @return key matching {@link #KEY_PATTERN}
     */
    String generateKey() {
        var sb = new StringBuilder(KEY_PREFIX.length() + KEY_BODY_LENGTH).append(KEY_PREFIX);
        for (int i = 0; i < KEY_BODY_LENGTH; i++) {
            sb.append(ALPHABET.charAt(SECURE_RANDOM.nextInt(ALPHABET.length())));
        }
        String key = sb.toString();
        if (!KEY_PATTERN.matcher(key).matches()) {
            throw new IllegalStateException("Generated key does not match the key format");
        }
        return key;
    }

    private CredentialScope validateScope(CredentialScope requested) {
        if (requested == null || requested.isEmpty()) {
            throw new InvalidScopeException("API keys must be scoped to a courier code or a warehouse");
        }

        String courierCode = null;
        if (requested.courierCode() != null) {
            courierCode = requested.courierCode().trim().toUpperCase(Locale.ROOT);
            if (!courierCodePattern.matcher(courierCode).matches()) {
                throw new InvalidScopeException("Invalid courier code '%s'".formatted(requested.courierCode()));
            }
        }

        String warehouseId = null;
        if (requested.warehouseId() != null) {
            warehouseId = requested.warehouseId().trim();
            if (!warehouseIdPattern.matcher(warehouseId).matches()) {
                throw new InvalidScopeException("Invalid warehouse reference '%s'".formatted(requested.warehouseId()));
            }
        }

        return new CredentialScope(courierCode, warehouseId);
    }

    private Set<String> validatePermissions(Set<String> requested) {
        Set<String> source = requested != null ? requested : config.defaultPermissions();
        Set<String> permissions = new LinkedHashSet<>();
        for (String permission : source) {
            String token = permission == null ? "" : permission.trim();
            if (!PERMISSION_PATTERN.matcher(token).matches()) {
                throw new IllegalArgumentException("Invalid permission '%s'".formatted(permission));
            }
            permissions.add(token);
        }
        return permissions;
    }

    /**
     * Resolves the requested lifetime against the configured default and maximum.
     *
     * @return lifetime, or null for a key that never expires
     * @throws IllegalArgumentException if the lifetime is not positive or exceeds the maximum
     */
    private Duration resolveTtl(Integer expiresInDays) {
        Duration ttl;
        if (expiresInDays == null) {
            ttl = config.defaultTtl().orElse(null);
        } else if (expiresInDays <= 0) {
            throw new IllegalArgumentException("expiresInDays must be positive");
        } else {
            ttl = Duration.ofDays(expiresInDays);
        }

        if (ttl == null) {
            config.maxTtl().ifPresent(maxTtl -> {
                throw new IllegalArgumentException(
                        "A lifetime is required. Maximum allowed: " + maxTtl.toDays() + " days");
            });
            return null;
        }

        config.maxTtl().ifPresent(maxTtl -> {
            if (ttl.compareTo(maxTtl) > 0) {
                throw new IllegalArgumentException("Lifetime exceeds maximum allowed. Requested: " + ttl.toDays()
                        + " days, Maximum: " + maxTtl.toDays() + " days");
            }
        });
        return ttl;
    }

    private String resolveName(String requested, CredentialScope scope) {
        if (requested != null && !requested.isBlank()) {
            return trimToLength(requested, MAX_NAME_LENGTH, "name");
        }
        String target = scope.courier().orElseGet(() -> "warehouse " + scope.warehouseId());
        return config.keyNamePrefix() + " " + target + " Integration";
    }

    private static String trimToLength(String value, int max, String field) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() > max) {
            throw new IllegalArgumentException("%s cannot exceed %d characters".formatted(field, max));
        }
        return trimmed;
    }

    private static Map<String, String> absolute(String base, Map<String, String> paths) {
        Map<String, String> result = new LinkedHashMap<>();
        paths.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> result.put(entry.getKey(), base + entry.getValue()));
        return result;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
