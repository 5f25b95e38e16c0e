package win.ixuni.hubstore.driver.memory.handler;

import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.driver.DriverCapabilities.Capability;
import win.ixuni.hubstore.core.model.ListFilesResult;
import win.ixuni.hubstore.core.operation.DriverContext;
import win.ixuni.hubstore.core.operation.OperationHandler;
import win.ixuni.hubstore.core.operation.file.ListFilesOperation;
import win.ixuni.hubstore.core.util.StoragePathUtils;
import win.ixuni.hubstore.driver.memory.context.MemoryDriverContext;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Memory ListFiles 处理器
 * <p>
 * Returns paths relative to the top-level namespace in lexical order. The continuation token is
 * the last name of the previous page.
 */
public class MemoryListFilesHandler implements OperationHandler<ListFilesOperation, ListFilesResult> {

    @Override
    public Mono<ListFilesResult> handle(ListFilesOperation operation, DriverContext context) {
        MemoryDriverContext ctx = (MemoryDriverContext) context;

        return Mono.fromCallable(() -> {
            String prefix = StoragePathUtils.join(operation.getStorageTopLevel()) + "/";
            String from = operation.getPage() != null ? prefix + operation.getPage() : prefix;

            List<String> entries = new ArrayList<>();
            boolean truncated = false;
            for (String contentPath : ctx.getFiles().tailMap(from, false).keySet()) {
                if (!contentPath.startsWith(prefix)) {
                    break;
                }
                if (entries.size() >= ctx.getPageSize()) {
                    truncated = true;
                    break;
                }
                entries.add(contentPath.substring(prefix.length()));
            }

            return ListFilesResult.builder()
                    .entries(entries)
                    .page(truncated ? entries.get(entries.size() - 1) : null)
                    .build();
        });
    }

    @Override
    public Class<ListFilesOperation> getOperationType() {
        return ListFilesOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.LIST, Capability.LIST_PAGINATION);
    }
}
