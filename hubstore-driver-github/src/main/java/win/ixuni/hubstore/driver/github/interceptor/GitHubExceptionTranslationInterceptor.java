package win.ixuni.hubstore.driver.github.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.exception.AuthenticationSetupException;
import win.ixuni.hubstore.core.exception.HubStoreException;
import win.ixuni.hubstore.core.exception.RemoteListException;
import win.ixuni.hubstore.core.exception.RemoteWriteException;
import win.ixuni.hubstore.core.operation.DriverContext;
import win.ixuni.hubstore.core.operation.HandlerInterceptor;
import win.ixuni.hubstore.core.operation.InterceptorChain;
import win.ixuni.hubstore.core.operation.Operation;
import win.ixuni.hubstore.core.operation.file.ListFilesOperation;
import win.ixuni.hubstore.core.operation.file.WriteFileOperation;
import win.ixuni.hubstore.driver.github.client.GitHubApiException;
import win.ixuni.hubstore.driver.github.context.GitHubDriverContext;

/**
 * GitHub exception conversion interceptor
 * <p>
 * Converts every client failure into the HubStore exception hierarchy: error responses, transport
 * failures and responses that cannot be decoded alike. HubStore exceptions raised by the handlers
 * (bad path, stream read) pass through.
 */
@Slf4j
public class GitHubExceptionTranslationInterceptor implements HandlerInterceptor {

    /**
     * Status reported when GitHub gave no usable answer
     */
    static final int NO_RESPONSE_STATUS = 502;

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation, DriverContext context, InterceptorChain<O, R> chain) {
        return chain.proceed(operation, context)
                .onErrorMap(e -> !(e instanceof HubStoreException),
                        e -> translateException(operation, (GitHubDriverContext) context, e));
    }

    private Throwable translateException(Operation<?> operation, GitHubDriverContext ctx, Throwable e) {
        int status = NO_RESPONSE_STATUS;
        String diagnostic = e.getMessage();
        if (e instanceof GitHubApiException apiException) {
            status = apiException.getStatusCode();
            diagnostic = apiException.getBackendMessage();
        }

        if (status == 401) {
            return new AuthenticationSetupException(
                    "GitHub rejected the credentials of driver '" + ctx.getDriverName() + "': " + diagnostic, e);
        }
        if (operation instanceof WriteFileOperation write) {
            return new RemoteWriteException(
                    ctx.contentPath(write.getStorageTopLevel(), write.getPath()), status, diagnostic, e);
        }
        if (operation instanceof ListFilesOperation list) {
            return new RemoteListException(ctx.listingPath(list.getStorageTopLevel()), status, diagnostic, e);
        }
        log.debug("Unmapped GitHub failure for operation {}, passing through", operation.getOperationName());
        return e;
    }

    @Override
    public int getOrder() {
        // Innermost, so the logging interceptor sees translated exceptions
        return 100;
    }
}
