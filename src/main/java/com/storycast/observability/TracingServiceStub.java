package com.storycast.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * No-op tracing when tracing.enabled is false. Span builders come from the no-op OpenTelemetry
 * instance so callers can use the same span code in both modes.
 */
@Service
@ConditionalOnProperty(name = "tracing.enabled", havingValue = "false", matchIfMissing = true)
public class TracingServiceStub implements TracingServiceInterface {

    private final Tracer tracer = OpenTelemetry.noop().getTracer("com.storycast");

    @Override
    public <T> T trace(@Nonnull String spanName, @Nonnull Supplier<T> operation) {
        return operation.get();
    }

    @Override
    public void trace(@Nonnull String spanName, @Nonnull Runnable operation) {
        operation.run();
    }

    @Override
    @Nonnull
    public SpanBuilder spanBuilder(@Nonnull String spanName) {
        return tracer.spanBuilder(spanName);
    }

    @Override
    public Span getCurrentSpan() {
        return Span.getInvalid();
    }
}
