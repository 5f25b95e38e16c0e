package win.ixuni.hubstore.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 写入结果
 * <p>
 * Produced only after the backend accepted the content.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WriteResult {

    /**
     * Absolute URL at which the written content is readable
     */
    private String url;

    /**
     * Backend-relative path of the content
     */
    private String contentPath;

    /**
     * Number of bytes stored
     */
    private long size;

    /**
     * Backend revision identifier (commit SHA, etag ...), may be null
     */
    private String revision;
}
