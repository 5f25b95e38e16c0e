package win.ixuni.hubstore.driver.github.client.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Body of the create-or-update-file call
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreateFileRequest {

    String message;

    Committer committer;

    /**
     * Base64 encoded file content
     */
    String content;

    String branch;

    /**
     * SHA of the blob being replaced, absent when creating
     */
    String sha;
}
