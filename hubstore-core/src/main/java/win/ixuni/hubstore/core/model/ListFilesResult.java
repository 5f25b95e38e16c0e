package win.ixuni.hubstore.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 列出文件返回结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
public class ListFilesResult {

    /**
     * Entry names in backend order
     */
    private List<String> entries;

    /**
     * Continuation token, null when the listing is known to be complete
     */
    private String page;
}
