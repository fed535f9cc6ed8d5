package dockhand.core.model.auth;

/**
 * Outcome of permanently deleting an API key.
 */
public record ApiKeyDeletion(String deletedId, String courierCode) {}
