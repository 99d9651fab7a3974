package com.brandcheck.observability;

import io.opentelemetry.api.trace.SpanBuilder;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * Tracing facade so the engine runs the same with tracing on or off.
 */
public interface TracingServiceInterface {
    <T> T trace(@Nonnull String spanName, @Nonnull Supplier<T> operation);
    @Nonnull SpanBuilder spanBuilder(@Nonnull String spanName);
}
