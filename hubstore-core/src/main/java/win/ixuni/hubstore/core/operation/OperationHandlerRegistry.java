package win.ixuni.hubstore.core.operation;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.driver.DriverCapabilities.Capability;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Operation handler registry
 * <p>
 * Maps operation classes to their handlers. Drivers register handlers and interceptors while
 * being constructed; afterwards the registry is only read.
 */
@Slf4j
public class OperationHandlerRegistry {

    private final Map<Class<?>, OperationHandler<?, ?>> handlers = new ConcurrentHashMap<>();
    private final List<HandlerInterceptor> interceptors = new CopyOnWriteArrayList<>();

    public <O extends Operation<R>, R> void register(OperationHandler<O, R> handler) {
        Class<O> operationType = handler.getOperationType();
        handlers.put(operationType, handler);
        log.debug("Registered handler for operation: {}", operationType.getSimpleName());
    }

    /**
     * 添加拦截器
     * <p>
     * Interceptors are kept sorted by {@link HandlerInterceptor#getOrder()}.
     */
    public void addInterceptor(HandlerInterceptor interceptor) {
        List<HandlerInterceptor> sorted = new ArrayList<>(interceptors);
        sorted.add(interceptor);
        sorted.sort(Comparator.comparingInt(HandlerInterceptor::getOrder));
        interceptors.clear();
        interceptors.addAll(sorted);
        log.debug("Added interceptor: {} with order {}",
                interceptor.getClass().getSimpleName(), interceptor.getOrder());
    }

    /**
     * @return handler, or null when the operation is not supported
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> OperationHandler<O, R> getHandler(Class<O> operationType) {
        return (OperationHandler<O, R>) handlers.get(operationType);
    }

    /**
     * Execute an operation through the interceptor chain
     *
     * @param operation the operation instance
     * @param context   driver context
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    @SuppressWarnings("unchecked")
    public <O extends Operation<R>, R> Mono<R> execute(O operation, DriverContext context) {
        Class<O> operationType = (Class<O>) operation.getClass();
        OperationHandler<O, R> handler = getHandler(operationType);

        if (handler == null) {
            return Mono.error(new UnsupportedOperationException(
                    "No handler registered for operation: " + operationType.getSimpleName()));
        }

        log.debug("Executing operation: {} with handler: {} through {} interceptors",
                operation.getOperationName(), handler.getClass().getSimpleName(), interceptors.size());

        InterceptorChain<O, R> chain = buildChain(handler, 0);
        // Defer so a handler that throws instead of signalling still ends up as an error signal
        return Mono.defer(() -> chain.proceed(operation, context));
    }

    private <O extends Operation<R>, R> InterceptorChain<O, R> buildChain(
            OperationHandler<O, R> handler, int index) {
        if (index >= interceptors.size()) {
            return handler::handle;
        }

        HandlerInterceptor interceptor = interceptors.get(index);
        InterceptorChain<O, R> nextChain = buildChain(handler, index + 1);

        return (op, ctx) -> interceptor.intercept(op, ctx, nextChain);
    }

    public boolean supports(Class<? extends Operation<?>> operationType) {
        return handlers.containsKey(operationType);
    }

    public int size() {
        return handlers.size();
    }

    public int interceptorCount() {
        return interceptors.size();
    }

    /**
     * Union of the capabilities declared by all registered handlers
     */
    public Set<Capability> getAggregatedCapabilities() {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        for (OperationHandler<?, ?> handler : handlers.values()) {
            capabilities.addAll(handler.getProvidedCapabilities());
        }
        return capabilities;
    }
}
