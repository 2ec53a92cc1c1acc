package ai.trilingual.translator.api;

/**
 * Edit of one language's text within a shared session.
 */
public record EditRequest(String sessionId, String language, String text) {
}
