package win.ixuni.hubstore.core.exception;

/**
 * Required backend identifier (owner, repository ...) missing
 */
public class MissingIdentifierException extends ConfigurationException {

    public MissingIdentifierException(String identifier) {
        super("MissingIdentifier", "You must supply a " + identifier);
    }
}
