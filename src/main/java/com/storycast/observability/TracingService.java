package com.storycast.observability;

import com.storycast.util.Strings;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * OpenTelemetry spans through {@link GlobalOpenTelemetry}, which an agent or SDK registers at startup.
 * Only active when tracing.enabled=true.
 */
@Service
@ConditionalOnProperty(name = "tracing.enabled", havingValue = "true", matchIfMissing = false)
public class TracingService implements TracingServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(TracingService.class);
    private final Tracer tracer;

    public TracingService() {
        this.tracer = GlobalOpenTelemetry.getTracer("com.storycast", "0.1.0");
        logger.info("TracingService initialized with OpenTelemetry tracer");
    }

    /**
     * Runs an operation inside a new span, recording any exception on it.
     */
    @Override
    public <T> T trace(@Nonnull String spanName, @Nonnull Supplier<T> operation) {
        Span span = tracer.spanBuilder(Strings.safe(spanName)).startSpan();
        try (Scope scope = span.makeCurrent()) {
            return operation.get();
        } catch (RuntimeException e) {
            markFailed(span, e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public void trace(@Nonnull String spanName, @Nonnull Runnable operation) {
        trace(spanName, () -> {
            operation.run();
            return null;
        });
    }

    @Override
    @Nonnull
    public SpanBuilder spanBuilder(@Nonnull String spanName) {
        return tracer.spanBuilder(Strings.safe(spanName));
    }

    @Override
    public Span getCurrentSpan() {
        return Span.current();
    }

    private static void markFailed(Span span, Exception e) {
        span.recordException(e);
        span.setStatus(StatusCode.ERROR);
        span.setAttribute("error", true);
        span.setAttribute("error.message", Strings.safe(e.getMessage()));
    }
}
