package ai.trilingual.translator.api;

/**
 * Request to translate one passage from {@code sourceLanguage} into the other two languages.
 */
public record PassageRequest(String text, String sourceLanguage) {
}
