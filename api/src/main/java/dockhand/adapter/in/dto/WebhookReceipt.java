package dockhand.adapter.in.dto;

import java.time.Instant;

/**
 * Acknowledgement returned to a webhook sender.
 *
 * @param event       the event name from the path
 * @param source      sender tag derived from the authenticating key
 * @param validatedAt when the key was validated
 */
public record WebhookReceipt(String event, String source, Instant validatedAt) {}
