package win.ixuni.hubstore.driver.github.handler;

import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.operation.DriverContext;
import win.ixuni.hubstore.core.operation.Operation;
import win.ixuni.hubstore.core.operation.OperationHandler;
import win.ixuni.hubstore.driver.github.context.GitHubDriverContext;

/**
 * GitHub Handler 抽象基类
 * <p>
 * 提供类型安全的 Context 访问，子类无需手动强制转换。
 *
 * @param <O> 操作类型
 * @param <R> 返回类型
 */
public abstract class AbstractGitHubHandler<O extends Operation<R>, R> implements OperationHandler<O, R> {

    @Override
    public final Mono<R> handle(O operation, DriverContext context) {
        if (!(context instanceof GitHubDriverContext)) {
            return Mono.error(new IllegalArgumentException(
                    "Expected GitHubDriverContext but got: " + context.getClass().getName()));
        }
        return doHandle(operation, (GitHubDriverContext) context);
    }

    protected abstract Mono<R> doHandle(O operation, GitHubDriverContext context);
}
