package io.certregistry.core.node;

import io.certregistry.core.event.EventBus;
import io.certregistry.core.event.EventJournal;
import io.certregistry.core.protocol.RegistryCall;
import io.certregistry.core.registry.CallProcessor;
import io.certregistry.core.registry.CertificateRegistry;
import io.certregistry.core.storage.InMemoryRegistryStore;
import io.certregistry.core.storage.RegistryStore;
import io.certregistry.core.storage.RocksDBRegistryStore;
import io.certregistry.core.wallet.Wallet;

import java.time.Clock;
import java.util.logging.Logger;

/**
 * Wires store, registry, event fan-out and the signed-call processor.
 */
public final class RegistryNode implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RegistryNode.class.getName());

    private final RegistryStore store;
    private final EventBus events;
    private final EventJournal journal;
    private final CertificateRegistry registry;
    private final CallProcessor processor;
    private final RegistryConfig config;

    public RegistryNode(RegistryStore store, String owner, Clock clock, RegistryConfig config) {
        this.store = store;
        this.config = config;
        this.events = new EventBus();
        this.journal = new EventJournal(config.journalCapacity, clock);
        this.events.subscribe(journal);
        this.registry = new CertificateRegistry(store, owner, config.registryId, clock, events);
        this.processor = new CallProcessor(registry);
    }

    /** Convenience factory for an in-memory node. */
    public static RegistryNode inMemory(RegistryConfig config, String owner) {
        return new RegistryNode(new InMemoryRegistryStore(), owner, Clock.systemUTC(), config);
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static RegistryNode rocks(RegistryConfig config, String owner, String dataDir) {
        RocksDBRegistryStore store = RocksDBRegistryStore.open(dataDir);
        try {
            return new RegistryNode(store, owner, Clock.systemUTC(), config);
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
    }

    /**
     * Authorize the configured bootstrap issuers as the owner. Already
     * authorized addresses are skipped. Safe to call multiple times.
     */
    public void start(Wallet ownerWallet) {
        if (!ownerWallet.getAddress().equals(registry.owner())) {
            throw new IllegalArgumentException("Wallet " + ownerWallet.getAddress() + " is not the registry owner");
        }
        for (String issuer : config.bootstrapIssuers) {
            if (registry.isIssuer(issuer)) {
                continue;
            }
            long nonce = processor.nextNonce(ownerWallet.getAddress());
            processor.submit(ownerWallet.sign(RegistryCall.addIssuer(registry.registryId(), ownerWallet.getAddress(), nonce, issuer).build()));
            LOG.info(() -> "Bootstrap issuer authorized: " + issuer);
        }
    }

    /** Close underlying resources if any (e.g., RocksDB). */
    @Override
    public void close() {
        if (store instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                throw new IllegalStateException("Failed to close registry store", e);
            }
        }
    }

    public RegistryStore store() { return store; }
    public EventBus events() { return events; }
    public EventJournal journal() { return journal; }
    public CertificateRegistry registry() { return registry; }
    public CallProcessor processor() { return processor; }
    public RegistryConfig config() { return config; }
}
