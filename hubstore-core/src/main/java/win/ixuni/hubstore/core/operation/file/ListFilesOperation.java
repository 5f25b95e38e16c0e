package win.ixuni.hubstore.core.operation.file;

import lombok.Value;
import win.ixuni.hubstore.core.model.ListFilesResult;
import win.ixuni.hubstore.core.operation.Operation;

/**
 * 列出文件操作
 */
@Value
public class ListFilesOperation implements Operation<ListFilesResult> {

    /**
     * Bucket-scoped top-level namespace
     */
    String storageTopLevel;

    /**
     * Continuation token from a previous listing, may be null
     */
    String page;
}
