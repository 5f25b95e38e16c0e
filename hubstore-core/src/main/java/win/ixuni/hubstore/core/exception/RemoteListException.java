package win.ixuni.hubstore.core.exception;

import lombok.Getter;

/**
 * The backend rejected or failed a listing
 */
@Getter
public class RemoteListException extends HubStoreException {

    /**
     * Raw diagnostic payload returned by the backend
     */
    private final String diagnostic;

    public RemoteListException(String listingPath, int status, String diagnostic, Throwable cause) {
        super("RemoteListError", "Failed to list " + listingPath + " (backend status " + status + "): "
                + diagnostic, status, cause);
        this.diagnostic = diagnostic;
    }
}
