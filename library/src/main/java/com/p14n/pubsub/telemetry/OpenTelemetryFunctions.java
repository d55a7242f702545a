package com.p14n.pubsub.telemetry;

import java.util.function.Supplier;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

public class OpenTelemetryFunctions {

        private OpenTelemetryFunctions() {
        }

        public static <T> T processWithTelemetry(Tracer tracer, String spanName, String topic,
                                                 Supplier<T> action) {

                Span span = tracer.spanBuilder(spanName)
                        .setAttribute("topic", topic)
                        .startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (Exception e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
