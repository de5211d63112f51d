package com.neohoods.bridge.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Configuration;

import io.micrometer.context.ContextRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Hooks;

/**
 * Copies the request trace id from the reactor context into the logging MDC on whichever thread handles a signal.
 */
@Configuration
@Slf4j
public class ReactiveContextConfig {

    @PostConstruct
    public void init() {
        ContextRegistry.getInstance().registerThreadLocalAccessor(
                TraceIdFilter.TRACE_ID_CONTEXT_KEY,
                () -> MDC.get(TraceIdFilter.TRACE_ID_CONTEXT_KEY),
                traceId -> MDC.put(TraceIdFilter.TRACE_ID_CONTEXT_KEY, traceId),
                () -> MDC.remove(TraceIdFilter.TRACE_ID_CONTEXT_KEY));
        Hooks.enableAutomaticContextPropagation();
        log.debug("Automatic context propagation enabled for {}", TraceIdFilter.TRACE_ID_CONTEXT_KEY);
    }
}
