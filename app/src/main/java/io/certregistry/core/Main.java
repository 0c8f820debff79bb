package io.certregistry.core;

import io.certregistry.core.api.ApiServer;
import io.certregistry.core.metrics.RegistryMetrics;
import io.certregistry.core.node.RegistryConfig;
import io.certregistry.core.node.RegistryNode;
import io.certregistry.core.protocol.CertHash;
import io.certregistry.core.protocol.RegistryCall;
import io.certregistry.core.registry.CallProcessor;
import io.certregistry.core.registry.CertificateRecord;
import io.certregistry.core.registry.CertificateStatus;
import io.certregistry.core.registry.RegistryException;
import io.certregistry.core.wallet.Wallet;
import io.certregistry.core.wallet.WalletStore;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        Path dataPath = options.dataDir().toAbsolutePath().normalize();
        Files.createDirectories(dataPath);

        WalletStore walletStore = new WalletStore(dataPath.resolve("wallets"));
        char[] passphrase = toPassword(options.walletPassphrase());
        Wallet owner = walletStore.ensureWallet(options.ownerAlias(), passphrase);

        RegistryConfig config = RegistryConfig.defaultLocal()
                .withOwnerAlias(options.ownerAlias())
                .withJournalCapacity(options.journalCapacity())
                .withBootstrapIssuers(options.issuers())
                .withRegistryId(options.registryId());
        RegistryNode node = options.inMemory()
                ? RegistryNode.inMemory(config, owner.getAddress())
                : RegistryNode.rocks(config, owner.getAddress(), dataPath.resolve("registry").toString());

        ApiServer apiServer = null;
        try {
            node.start(owner);
            LOG.info("Owner addr=" + owner.getAddress() + " (wallet '" + options.ownerAlias() + "'), registry id "
                    + node.registry().registryId());

            if (options.demo()) {
                runDemoFlow(node, walletStore, owner, passphrase);
            }
            clear(passphrase);

            if (options.enableApi()) {
                apiServer = new ApiServer(node, options.apiBind(), options.apiPort(), options.apiToken());
                apiServer.start();
            }

            if (options.keepAlive()) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "cert-registry-shutdown"));
                LOG.info("Registry running. Press CTRL+C to exit.");
                shutdownLatch.await();
            }
        } finally {
            clear(passphrase);
            if (apiServer != null) {
                apiServer.stop();
            }
            node.close();
        }
    }

    private static char[] toPassword(String value) {
        return value != null && !value.isEmpty() ? value.toCharArray() : null;
    }

    private static void clear(char[] passphrase) {
        if (passphrase != null) {
            Arrays.fill(passphrase, '\0');
        }
    }

    private static void configureLogging() throws IOException {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        }
    }

    /**
     * Issue, verify and revoke as the owner; then let a second issuer issue
     * and show that another issuer cannot revoke its record while the owner can.
     */
    private static void runDemoFlow(RegistryNode node, WalletStore walletStore, Wallet owner, char[] passphrase)
            throws IOException {
        CallProcessor processor = node.processor();
        String registryId = node.registry().registryId();
        Wallet issuer = walletStore.ensureWallet("demo-issuer", passphrase);
        Wallet other = walletStore.ensureWallet("demo-other", passphrase);

        String first = freeId(node, "A-1");
        CertHash h1 = CertHash.of(("certificate " + first).getBytes(StandardCharsets.UTF_8));
        submit(processor, owner, RegistryCall.issue(registryId, owner.getAddress(), processor.nextNonce(owner.getAddress()), first, h1, "ipfs://demo/" + first));
        LOG.info("verify(" + first + ") = " + node.registry().verifyCertificate(first, h1));
        submit(processor, owner, RegistryCall.revoke(registryId, owner.getAddress(), processor.nextNonce(owner.getAddress()), first));
        LOG.info("verify(" + first + ") after revoke = " + node.registry().verifyCertificate(first, h1));
        CertificateRecord record = node.registry().getCertificate(first);
        LOG.info("get(" + first + ") = " + record);

        submit(processor, owner, RegistryCall.addIssuer(registryId, owner.getAddress(), processor.nextNonce(owner.getAddress()), issuer.getAddress()));
        submit(processor, owner, RegistryCall.addIssuer(registryId, owner.getAddress(), processor.nextNonce(owner.getAddress()), other.getAddress()));
        String second = freeId(node, "B-2");
        CertHash h2 = CertHash.of(("certificate " + second).getBytes(StandardCharsets.UTF_8));
        submit(processor, issuer, RegistryCall.issue(registryId, issuer.getAddress(), processor.nextNonce(issuer.getAddress()), second, h2, ""));
        try {
            submit(processor, other, RegistryCall.revoke(registryId, other.getAddress(), processor.nextNonce(other.getAddress()), second));
        } catch (RegistryException e) {
            LOG.info("Unrelated issuer could not revoke " + second + ": " + e.reason());
        }
        submit(processor, owner, RegistryCall.revoke(registryId, owner.getAddress(), processor.nextNonce(owner.getAddress()), second));
        LOG.info("Owner revoked " + second + "; status=" + node.registry().status(second));
        LOG.info("=== Metrics ===\n" + RegistryMetrics.scrapeMetrics());
    }

    private static void submit(CallProcessor processor, Wallet signer, RegistryCall.Builder call) {
        processor.submit(signer.sign(call.build()));
    }

    /** {@code base}, or {@code base-n} when a persisted registry already holds it from an earlier run. */
    private static String freeId(RegistryNode node, String base) {
        String id = base;
        for (int n = 2; node.registry().status(id) != CertificateStatus.ABSENT; n++) {
            id = base + "-" + n;
        }
        return id;
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            boolean inMemory,
            String ownerAlias,
            List<String> issuers,
            boolean enableApi,
            String apiBind,
            int apiPort,
            String apiToken,
            boolean keepAlive,
            boolean demo,
            int journalCapacity,
            String registryId,
            String walletPassphrase
    ) {
        static CliOptions parse(String[] args) {
            Path dataDir = envPath("CERT_REGISTRY_DATA_DIR", Path.of("./data/registry"));
            boolean inMemory = false;
            String ownerAlias = envOrDefault("CERT_REGISTRY_OWNER", "owner");
            List<String> issuers = new ArrayList<>();
            boolean enableApi = true;
            String apiBind = envOrDefault("CERT_REGISTRY_API_BIND", "127.0.0.1");
            int apiPort = 8080;
            String apiToken = System.getenv("CERT_REGISTRY_API_TOKEN");
            boolean keepAlive = false;
            boolean demo = false;
            int journalCapacity = RegistryConfig.defaultLocal().journalCapacity;
            String registryId = System.getenv("CERT_REGISTRY_ID");
            String walletPassphrase = System.getenv("CERT_REGISTRY_WALLET_PASSPHRASE");
            boolean showHelp = false;
            String error = null;

            try {
                apiPort = envPort("CERT_REGISTRY_API_PORT", 8080);
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.equals("--in-memory")) {
                        inMemory = true;
                    } else if (arg.startsWith("--owner=")) {
                        ownerAlias = arg.substring("--owner=".length()).trim();
                    } else if (arg.startsWith("--issuer=")) {
                        issuers.add(arg.substring("--issuer=".length()).trim());
                    } else if (arg.equals("--no-api")) {
                        enableApi = false;
                    } else if (arg.startsWith("--api-bind=")) {
                        apiBind = arg.substring("--api-bind=".length());
                    } else if (arg.startsWith("--api-port=")) {
                        try {
                            apiPort = parsePort(arg.substring("--api-port=".length()), "--api-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--api-token=")) {
                        apiToken = arg.substring("--api-token=".length());
                    } else if (arg.startsWith("--registry-id=")) {
                        registryId = arg.substring("--registry-id=".length()).trim();
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (arg.startsWith("--journal-capacity=")) {
                        try {
                            journalCapacity = parsePositiveInt(arg.substring("--journal-capacity=".length()), "--journal-capacity");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (ownerAlias == null || ownerAlias.isBlank()) {
                showHelp = true;
                error = error != null ? error : "Owner alias must not be blank";
            }
            if (apiToken != null && apiToken.isBlank()) {
                apiToken = null;
            }
            if (registryId != null && registryId.isBlank()) {
                registryId = null;
            }
            keepAlive = keepAlive || enableApi || "true".equalsIgnoreCase(System.getenv("CERT_REGISTRY_KEEP_ALIVE"));

            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    inMemory,
                    ownerAlias,
                    List.copyOf(issuers),
                    enableApi,
                    apiBind,
                    apiPort,
                    apiToken,
                    keepAlive,
                    demo,
                    journalCapacity,
                    registryId,
                    walletPassphrase
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: cert-registry [options]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for registry data and wallets (default ./data/registry)
  --in-memory                Keep registry state in memory only (wallets still on disk)
  --owner=<alias>            Wallet alias of the registry owner (default owner)
  --issuer=<address>         Authorize an issuer at startup (repeatable)
  --no-api                   Do not start the HTTP API
  --api-bind=<host>          Bind address for the HTTP API (default 127.0.0.1)
  --api-port=<port>          Port for the HTTP API (default 8080)
  --api-token=<token>        Require Bearer/X-API-Key token for the HTTP API
  --keep-alive               Keep running until interrupted (implied by the API)
  --demo / --no-demo         Run (or skip, default) the issue/verify/revoke demo
  --journal-capacity=<n>     Events kept for /events (default 1024)
  --registry-id=<id>         Registry id signed into every call (default: stored, else random)

Environment overrides:
  CERT_REGISTRY_DATA_DIR     Override --data-dir
  CERT_REGISTRY_OWNER        Override --owner
  CERT_REGISTRY_API_BIND     Override --api-bind
  CERT_REGISTRY_API_PORT     Override --api-port
  CERT_REGISTRY_API_TOKEN    Token for API auth (if --api-token not supplied)
  CERT_REGISTRY_KEEP_ALIVE   Set to "true" to force keep-alive mode
  CERT_REGISTRY_ID           Override --registry-id
  CERT_REGISTRY_WALLET_PASSPHRASE
                             Encrypt new wallets and unlock existing ones with this passphrase
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static int parsePositiveInt(String value, String flag) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed <= 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
