package ai.trilingual.translator.translate;

/**
 * Runtime exception used to signal a failed remote translation call.
 */
public class TranslationException extends RuntimeException {

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
