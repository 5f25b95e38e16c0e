package win.ixuni.hubstore.core.exception;

import lombok.Getter;

/**
 * The backend rejected or failed a write
 */
@Getter
public class RemoteWriteException extends HubStoreException {

    /**
     * Raw diagnostic payload returned by the backend
     */
    private final String diagnostic;

    public RemoteWriteException(String contentPath, int status, String diagnostic, Throwable cause) {
        super("RemoteWriteError", "Failed to store " + contentPath + " (backend status " + status + "): "
                + diagnostic, status, cause);
        this.diagnostic = diagnostic;
    }
}
