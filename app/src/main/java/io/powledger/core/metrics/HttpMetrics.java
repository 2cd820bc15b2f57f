package io.powledger.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/** Request timing for the API server plus a counter of chain-file validations by outcome. */
public final class HttpMetrics {
    private static final MeterRegistry REGISTRY = BlockMetrics.registry();

    private HttpMetrics() {}

    public static Timer.Sample start() {
        return Timer.start(REGISTRY);
    }

    public static void stop(Timer.Sample sample, String method, String path, int status) {
        Timer timer = Timer
                .builder("http.server.requests")
                .description("HTTP server request duration")
                .tag("method", method)
                .tag("path", path)
                .tag("status", Integer.toString(status))
                .register(REGISTRY);
        sample.stop(timer);
    }

    public static void recordImport(boolean parsed) {
        Counter.builder("chain.import.requests")
                .description("Uploaded chain files by parse outcome")
                .tag("outcome", parsed ? "parsed" : "malformed")
                .register(REGISTRY)
                .increment();
    }
}
