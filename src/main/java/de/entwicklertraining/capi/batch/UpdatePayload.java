package de.entwicklertraining.capi.batch;

/**
 * Payload of an update operation: the target GUID plus the update request.
 */
public record UpdatePayload<U>(String guid, U request) {
}
