package win.ixuni.hubstore.core.operation;

import reactor.core.publisher.Mono;

/**
 * Handler 拦截器接口
 * <p>
 * Allows inserting common logic around handler execution, such as logging or error translation.
 */
public interface HandlerInterceptor {

    /**
     * Intercept a handler execution
     *
     * @param operation the operation instance
     * @param context   driver context
     * @param chain     remaining interceptors and the handler
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            DriverContext context,
            InterceptorChain<O, R> chain);

    /**
     * Interceptor order, lower runs first (outermost)
     */
    default int getOrder() {
        return 0;
    }
}
