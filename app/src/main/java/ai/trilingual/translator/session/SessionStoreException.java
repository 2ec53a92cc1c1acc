package ai.trilingual.translator.session;

/**
 * Signals that the session store could not read or persist a session.
 */
public class SessionStoreException extends RuntimeException {

    public SessionStoreException(String message) {
        super(message);
    }

    public SessionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
