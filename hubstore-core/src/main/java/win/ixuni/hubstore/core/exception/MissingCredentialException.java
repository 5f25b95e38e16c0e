package win.ixuni.hubstore.core.exception;

/**
 * Credential token missing or empty
 */
public class MissingCredentialException extends ConfigurationException {

    public MissingCredentialException(String authType) {
        super("MissingCredential", "Using " + authType + " authentication but no token supplied");
    }
}
