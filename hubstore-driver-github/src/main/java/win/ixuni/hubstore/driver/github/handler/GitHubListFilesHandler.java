package win.ixuni.hubstore.driver.github.handler;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.driver.DriverCapabilities.Capability;
import win.ixuni.hubstore.core.model.ListFilesResult;
import win.ixuni.hubstore.core.operation.file.ListFilesOperation;
import win.ixuni.hubstore.driver.github.client.model.ContentEntry;
import win.ixuni.hubstore.driver.github.config.GitHubDriverConfig;
import win.ixuni.hubstore.driver.github.context.GitHubDriverContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * GitHub 列出文件处理器
 * <p>
 * One directory-contents call, entry names only. Continuation tokens are not applied and the
 * result never carries one, so only the first backend response is visible.
 */
@Slf4j
public class GitHubListFilesHandler extends AbstractGitHubHandler<ListFilesOperation, ListFilesResult> {

    @Override
    protected Mono<ListFilesResult> doHandle(ListFilesOperation operation, GitHubDriverContext ctx) {
        GitHubDriverConfig gh = ctx.getGitHubConfig();
        String listingPath = ctx.listingPath(operation.getStorageTopLevel());

        if (operation.getPage() != null) {
            log.debug("Ignoring page '{}' for {}: the GitHub driver does not page listings",
                    operation.getPage(), listingPath);
        }

        return ctx.getClient()
                .getDirectoryContents(gh.getOwner(), gh.getRepo(), listingPath, gh.getRef())
                .map(entries -> ListFilesResult.builder()
                        .entries(entries.stream().map(ContentEntry::getName).toList())
                        .page(null)
                        .build());
    }

    @Override
    public Class<ListFilesOperation> getOperationType() {
        return ListFilesOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.LIST);
    }
}
