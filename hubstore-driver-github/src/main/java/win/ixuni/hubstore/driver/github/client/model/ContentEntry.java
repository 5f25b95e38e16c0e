package win.ixuni.hubstore.driver.github.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of a repository contents response
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContentEntry {

    private String name;

    private String path;

    /**
     * Blob SHA
     */
    private String sha;

    private Long size;

    /**
     * file, dir, symlink or submodule
     */
    private String type;
}
