package win.ixuni.hubstore.driver.github.client.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a successful file commit
 */
@Value
@Builder
public class FileCommit {

    String commitSha;

    String path;

    /**
     * SHA of the stored blob
     */
    String contentSha;
}
