package win.ixuni.hubstore.core.exception;

/**
 * The backend client could not be set up with the configured credentials
 * <p>
 * May surface on the first remote call instead of at construction; callers treat both the same way.
 */
public class AuthenticationSetupException extends HubStoreException {

    public AuthenticationSetupException(String message) {
        super("AuthenticationSetupError", message, 401);
    }

    public AuthenticationSetupException(String message, Throwable cause) {
        super("AuthenticationSetupError", message, 401, cause);
    }
}
