package win.ixuni.hubstore.core.operation;

import reactor.core.publisher.Mono;

/**
 * Handler 拦截器链接口
 *
 * @param <O> 操作类型
 * @param <R> 返回类型
 */
@FunctionalInterface
public interface InterceptorChain<O extends Operation<R>, R> {

    Mono<R> proceed(O operation, DriverContext context);
}
