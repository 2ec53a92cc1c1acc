package ai.trilingual.translator.api;

/**
 * Client error: the request is missing a field or carries a value outside its domain. Never retried.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
