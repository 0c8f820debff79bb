package io.certregistry.core.metrics;

import io.certregistry.core.registry.RegistryException;
import io.certregistry.core.registry.VerificationResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Measurement;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;

public final class RegistryMetrics {
    private static final MeterRegistry registry = new SimpleMeterRegistry();
    private static final Counter certificatesIssued = Counter.builder("registry.certificates.issued")
            .description("Certificates issued")
            .register(registry);
    private static final Counter certificatesRevoked = Counter.builder("registry.certificates.revoked")
            .description("Certificates revoked")
            .register(registry);
    private static final Counter issuerChanges = Counter.builder("registry.issuers.changes")
            .description("Issuer add/remove operations applied")
            .register(registry);

    private RegistryMetrics() {}

    public static void incrementIssued() {
        certificatesIssued.increment();
    }

    public static void incrementRevoked() {
        certificatesRevoked.increment();
    }

    public static void incrementIssuerChanges() {
        issuerChanges.increment();
    }

    public static void recordVerification(VerificationResult result) {
        registry.counter("registry.verifications", "result", result.name().toLowerCase(Locale.ROOT)).increment();
    }

    public static void recordRejected(RegistryException.Reason reason) {
        registry.counter("registry.rejections", "reason", reason.name().toLowerCase(Locale.ROOT)).increment();
    }

    public static String scrapeMetrics() {
        StringBuilder sb = new StringBuilder();
        for (Meter m : registry.getMeters()) {
            for (Measurement meas : m.measure()) {
                sb.append(m.getId().getName());
                sb.append("{stat=").append(meas.getStatistic());
                m.getId().getTags().forEach(t -> sb.append(',').append(t.getKey()).append('=').append(t.getValue()));
                sb.append("} ").append(meas.getValue()).append('\n');
            }
        }
        return sb.toString();
    }

    public static MeterRegistry registry() {
        return registry;
    }
}
