package io.certregistry.core.node;

import java.util.List;

/** Simple config holder for a registry node. */
public final class RegistryConfig {
    public final String ownerAlias;
    public final int journalCapacity;
    public final List<String> bootstrapIssuers;
    /** Signed into every call; null keeps the stored id or generates one. */
    public final String registryId;

    public RegistryConfig(String ownerAlias, int journalCapacity, List<String> bootstrapIssuers) {
        this(ownerAlias, journalCapacity, bootstrapIssuers, null);
    }

    public RegistryConfig(String ownerAlias, int journalCapacity, List<String> bootstrapIssuers, String registryId) {
        if (journalCapacity <= 0) {
            throw new IllegalArgumentException("journalCapacity must be > 0");
        }
        if (registryId != null && registryId.isBlank()) {
            throw new IllegalArgumentException("registryId must not be blank");
        }
        this.ownerAlias = ownerAlias;
        this.journalCapacity = journalCapacity;
        this.bootstrapIssuers = List.copyOf(bootstrapIssuers);
        this.registryId = registryId;
    }

    public static RegistryConfig defaultLocal() {
        return new RegistryConfig(
                "owner",      // wallet alias holding the owner key
                1024,         // events kept for /events
                List.of()     // no extra issuers at startup
        );
    }

    public RegistryConfig withOwnerAlias(String ownerAlias) {
        return new RegistryConfig(ownerAlias, journalCapacity, bootstrapIssuers, registryId);
    }

    public RegistryConfig withJournalCapacity(int journalCapacity) {
        return new RegistryConfig(ownerAlias, journalCapacity, bootstrapIssuers, registryId);
    }

    public RegistryConfig withBootstrapIssuers(List<String> bootstrapIssuers) {
        return new RegistryConfig(ownerAlias, journalCapacity, bootstrapIssuers, registryId);
    }

    public RegistryConfig withRegistryId(String registryId) {
        return new RegistryConfig(ownerAlias, journalCapacity, bootstrapIssuers, registryId);
    }
}
