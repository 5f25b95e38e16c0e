package win.ixuni.hubstore.driver.github.client;

import reactor.core.publisher.Mono;
import win.ixuni.hubstore.driver.github.client.model.Committer;
import win.ixuni.hubstore.driver.github.client.model.ContentEntry;
import win.ixuni.hubstore.driver.github.client.model.FileCommit;

import java.util.List;

/**
 * Repository contents API used by the GitHub driver
 * <p>
 * Failures are signalled as {@link GitHubApiException} when GitHub answered, or as the
 * transport's own exception when it did not.
 */
public interface GitHubContentsClient {

    /**
     * Commit a whole file to a branch, creating it or replacing its content
     *
     * @param owner     repository owner
     * @param repo      repository name
     * @param path      file path inside the repository
     * @param branch    branch receiving the commit
     * @param message   commit message
     * @param committer commit identity
     * @param content   raw file content
     * @return the resulting commit
     */
    Mono<FileCommit> createOrUpdateFile(String owner, String repo, String path, String branch,
                                        String message, Committer committer, byte[] content);

    /**
     * List a directory
     *
     * @param owner repository owner
     * @param repo  repository name
     * @param path  directory path inside the repository, empty for the root
     * @param ref   branch, tag or commit; null for the default branch
     * @return directory entries in the order GitHub returned them
     */
    Mono<List<ContentEntry>> getDirectoryContents(String owner, String repo, String path, String ref);
}
