package com.neohoods.bridge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import reactor.core.publisher.Mono;
import reactor.util.context.Context;

@DisplayName("ReactiveContextConfig Unit Tests")
class ReactiveContextConfigTest {

    @BeforeEach
    void setUp() {
        new ReactiveContextConfig().init();
    }

    @AfterEach
    void tearDown() {
        MDC.remove(TraceIdFilter.TRACE_ID_CONTEXT_KEY);
    }

    @Test
    @DisplayName("the trace id written by the filter should be visible in the MDC while handling a signal")
    void testTraceIdReachesMdc() {
        // When
        String seen = Mono.just("signal")
                .<String>handle((value, sink) -> sink.next(String.valueOf(MDC.get(TraceIdFilter.TRACE_ID_CONTEXT_KEY))))
                .contextWrite(Context.of(TraceIdFilter.TRACE_ID_CONTEXT_KEY, "trace-123"))
                .block();

        // Then
        assertEquals("trace-123", seen);
    }
}
