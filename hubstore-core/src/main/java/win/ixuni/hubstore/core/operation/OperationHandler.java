package win.ixuni.hubstore.core.operation;

import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.driver.DriverCapabilities.Capability;

import java.util.Collections;
import java.util.Set;

/**
 * Operation handler interface
 * <p>
 * Each driver provides the handler implementation for the operations it supports.
 *
 * @param <O> 操作类型
 * @param <R> 返回类型
 */
public interface OperationHandler<O extends Operation<R>, R> {

    /**
     * Handle the operation
     *
     * @param operation the operation instance
     * @param context   驱动上下文
     * @return operation result; failures are error signals, never thrown
     */
    Mono<R> handle(O operation, DriverContext context);

    /**
     * 获取此处理器支持的操作类型
     */
    Class<O> getOperationType();

    /**
     * Capabilities contributed by this handler
     * <p>
     * The driver total capability is the union of all registered handler capabilities.
     *
     * @return 能力集合，默认为空
     */
    default Set<Capability> getProvidedCapabilities() {
        return Collections.emptySet();
    }
}
