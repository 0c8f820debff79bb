package io.certregistry.core.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

public final class HttpMetrics {
    private static final MeterRegistry REGISTRY = RegistryMetrics.registry();

    private HttpMetrics() {}

    public static Timer.Sample start() {
        return Timer.start(REGISTRY);
    }

    /** {@code route} is the handler's context path, so tag cardinality stays bounded. */
    public static void stop(Timer.Sample sample, String method, String route, int status) {
        Timer timer = Timer
                .builder("registry.api.requests")
                .description("Registry API request duration")
                .tag("method", method)
                .tag("route", route)
                .tag("outcome", outcome(status))
                .tag("status", Integer.toString(status))
                .register(REGISTRY);
        sample.stop(timer);
    }

    private static String outcome(int status) {
        if (status >= 500) return "SERVER_ERROR";
        if (status >= 400) return "CLIENT_ERROR";
        return "SUCCESS";
    }
}
