package ai.trilingual.translator.api;

/**
 * Staleness check carrying the last revision the device has seen.
 */
public record PollRequest(String sessionId, long sinceRevision) {
}
