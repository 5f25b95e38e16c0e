package win.ixuni.hubstore.core.operation.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.operation.DriverContext;
import win.ixuni.hubstore.core.operation.HandlerInterceptor;
import win.ixuni.hubstore.core.operation.InterceptorChain;
import win.ixuni.hubstore.core.operation.Operation;

/**
 * 日志拦截器
 * <p>
 * Logs every operation with its duration and outcome.
 */
@Slf4j
public class LoggingInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            DriverContext context,
            InterceptorChain<O, R> chain) {

        final String operationName = operation.getOperationName();
        final String driverName = context.getDriverName();

        return Mono.defer(() -> {
            final long startTime = System.currentTimeMillis();
            log.debug("[{}] Starting operation: {}", driverName, operationName);

            return chain.proceed(operation, context)
                    .doOnSuccess(result -> log.debug("[{}] Operation {} completed successfully in {}ms",
                            driverName, operationName, System.currentTimeMillis() - startTime))
                    .doOnError(error -> log.warn("[{}] Operation {} failed after {}ms: {}",
                            driverName, operationName, System.currentTimeMillis() - startTime,
                            error.getMessage()));
        });
    }

    @Override
    public int getOrder() {
        return -100; // 最外层拦截器
    }
}
