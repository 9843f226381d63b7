package com.storycast.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * Span creation for model calls and sessions, with an OpenTelemetry and a no-op implementation.
 */
public interface TracingServiceInterface {
    <T> T trace(@Nonnull String spanName, @Nonnull Supplier<T> operation);
    void trace(@Nonnull String spanName, @Nonnull Runnable operation);
    @Nonnull SpanBuilder spanBuilder(@Nonnull String spanName);
    Span getCurrentSpan();
}
