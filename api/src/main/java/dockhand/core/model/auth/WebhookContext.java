package dockhand.core.model.auth;

import java.time.Instant;

/**
 * Attached to inbound webhook calls instead of a {@link Principal}.
 *
 * <p>Webhook handlers key idempotency off payload fields, so only the sender's
 * tag and the time of validation are carried.
 *
 * @param source      sender tag, the key's courier code or name
 * @param keyId       id of the key that authenticated the call
 * @param validatedAt when the key was validated
 */
public record WebhookContext(String source, String keyId, Instant validatedAt) {}
