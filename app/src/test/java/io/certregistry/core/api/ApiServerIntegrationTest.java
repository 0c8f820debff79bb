package io.certregistry.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.certregistry.core.client.RegistryClient;
import io.certregistry.core.node.RegistryConfig;
import io.certregistry.core.node.RegistryNode;
import io.certregistry.core.protocol.CertHash;
import io.certregistry.core.protocol.RegistryCall;
import io.certregistry.core.registry.CertificateRecord;
import io.certregistry.core.registry.RegistryException;
import io.certregistry.core.registry.VerificationResult;
import io.certregistry.core.wallet.Wallet;
import io.certregistry.core.wallet.WalletStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ApiServerIntegrationTest {

    private static final CertHash H1 = CertHash.fromHex("a1".repeat(32));
    private static final CertHash H2 = CertHash.fromHex("b2".repeat(32));

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();

    private ApiServer server;
    private RegistryNode node;
    private Wallet owner;
    private Wallet issuer;
    private Wallet other;
    private RegistryClient client;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        port = freePort();
        WalletStore wallets = new WalletStore(tempDir);
        owner = wallets.createWallet("owner");
        issuer = wallets.createWallet("issuer");
        other = wallets.createWallet("other");

        node = RegistryNode.inMemory(RegistryConfig.defaultLocal(), owner.getAddress());
        node.start(owner);
        server = new ApiServer(node, "127.0.0.1", port, "api-secret");
        server.start();
        client = new RegistryClient("http://127.0.0.1:" + port, "api-secret");
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (node != null) {
            node.close();
        }
    }

    @Test
    void issueVerifyRevokeThroughClient() {
        CertificateRecord issued = client.issueCertificate(owner, "A-1", H1, "ipfs://QmA1");
        assertEquals(owner.getAddress(), issued.issuedBy());
        assertFalse(issued.revoked());

        assertTrue(client.verifyCertificate("A-1", H1));
        assertFalse(client.verifyCertificate("A-1", H2));
        assertEquals(VerificationResult.HASH_MISMATCH, client.diagnoseCertificate("A-1", H2));

        CertificateRecord revoked = client.revokeCertificate(owner, "A-1");
        assertTrue(revoked.revoked());
        assertFalse(client.verifyCertificate("A-1", H1));

        CertificateRecord fetched = client.getCertificate("A-1");
        assertEquals(H1, fetched.certHash());
        assertEquals("ipfs://QmA1", fetched.ipfsCid());
        assertTrue(fetched.revoked());
        assertEquals(2, client.nonce(owner.getAddress()));
    }

    @Test
    void issuerLifecycleAndRevocationRights() {
        client.addIssuer(owner, issuer.getAddress());
        client.addIssuer(owner, other.getAddress());
        assertTrue(client.isIssuer(issuer.getAddress()));
        assertTrue(client.issuers().contains(other.getAddress()));

        client.issueCertificate(issuer, "B-2", H2, "");
        RegistryException denied = assertThrows(RegistryException.class, () -> client.revokeCertificate(other, "B-2"));
        assertEquals(RegistryException.Reason.AUTHORIZATION, denied.reason());
        assertTrue(client.verifyCertificate("B-2", H2));

        client.revokeCertificate(owner, "B-2");
        assertFalse(client.verifyCertificate("B-2", H2));

        client.removeIssuer(owner, issuer.getAddress());
        assertFalse(client.isIssuer(issuer.getAddress()));
        RegistryException blocked = assertThrows(RegistryException.class,
                () -> client.issueCertificate(issuer, "B-3", H1, ""));
        assertEquals(RegistryException.Reason.AUTHORIZATION, blocked.reason());
    }

    @Test
    void registryErrorsMapToReasons() {
        client.issueCertificate(owner, "E-1", H1, "");
        assertEquals(RegistryException.Reason.ALREADY_EXISTS,
                assertThrows(RegistryException.class, () -> client.issueCertificate(owner, "E-1", H2, "")).reason());
        assertEquals(RegistryException.Reason.NOT_FOUND,
                assertThrows(RegistryException.class, () -> client.getCertificate("missing")).reason());
        assertEquals(RegistryException.Reason.NOT_FOUND,
                assertThrows(RegistryException.class, () -> client.revokeCertificate(owner, "missing")).reason());
        client.revokeCertificate(owner, "E-1");
        assertEquals(RegistryException.Reason.ALREADY_REVOKED,
                assertThrows(RegistryException.class, () -> client.revokeCertificate(owner, "E-1")).reason());
        assertEquals(RegistryException.Reason.AUTHORIZATION,
                assertThrows(RegistryException.class, () -> client.addIssuer(issuer, other.getAddress())).reason());
        assertEquals(VerificationResult.NOT_FOUND, client.diagnoseCertificate("missing", H1));
    }

    @Test
    void statusAndEventsReflectOperations() {
        client.issueCertificate(owner, "S-1", H1, "cid");
        client.revokeCertificate(owner, "S-1");

        JsonNode status = client.status();
        assertEquals(owner.getAddress(), status.path("owner").asText());
        assertEquals(node.registry().registryId(), status.path("registryId").asText());
        assertEquals(node.registry().registryId(), client.registryId());
        assertEquals(1, status.path("certificates").asLong());
        assertEquals(3, status.path("lastEvent").asLong());

        JsonNode events = client.events(1);
        assertEquals(2, events.path("events").size());
        assertEquals("CertificateIssued", events.path("events").get(0).path("type").asText());
        assertEquals("CertificateRevoked", events.path("events").get(1).path("type").asText());
        assertEquals(owner.getAddress(), events.path("events").get(1).path("revoker").asText());
    }

    @Test
    void callWithoutSignatureIsRejected() throws Exception {
        String payload = mapper.createObjectNode()
                .put("caller", owner.getAddress())
                .put("nonce", 0)
                .put("certId", "U-1")
                .put("certHash", H1.hex())
                .toString();

        HttpResponse<String> response = post("/certificates/issue", payload);
        assertEquals(400, response.statusCode());
        assertTrue(response.body().contains("missing_signature"));
        assertEquals(0, node.registry().certificateCount());
    }

    @Test
    void ownerLookupAcceptsPrefixedUppercaseAddress() throws Exception {
        String query = "0x" + owner.getAddress().toUpperCase(Locale.ROOT);
        JsonNode resp = mapper.readTree(get("/issuers?address=" + query).body());
        assertTrue(resp.path("owner").asBoolean());
        assertTrue(resp.path("authorized").asBoolean());

        JsonNode stranger = mapper.readTree(get("/issuers?address=" + issuer.getAddress()).body());
        assertFalse(stranger.path("owner").asBoolean());
    }

    @Test
    void callSignedForAnotherRegistryIsRejected() throws Exception {
        client.addIssuer(owner, issuer.getAddress());
        long nonce = client.nonce(owner.getAddress());
        RegistryCall foreign = owner.sign(
                RegistryCall.removeIssuer("other-registry", owner.getAddress(), nonce, issuer.getAddress()).build());

        HttpResponse<String> response = post("/issuers/remove", signedBody(foreign).toString());
        assertEquals(400, response.statusCode());
        assertEquals("invalid_argument", mapper.readTree(response.body()).path("error").asText());
        assertTrue(node.registry().isIssuer(issuer.getAddress()));
        assertEquals(nonce, client.nonce(owner.getAddress()));

        ObjectNode unnamed = signedBody(foreign);
        unnamed.remove("registryId");
        HttpResponse<String> missing = post("/issuers/remove", unnamed.toString());
        assertEquals(400, missing.statusCode());
        assertTrue(missing.body().contains("missing_registry_id"));
    }

    @Test
    void malformedJsonAndWrongMethod() throws Exception {
        HttpResponse<String> badJson = post("/certificates/issue", "{not json");
        assertEquals(400, badJson.statusCode());
        assertTrue(badJson.body().contains("invalid_json"));

        HttpRequest get = HttpRequest.newBuilder(new URI("http://127.0.0.1:" + port + "/certificates/issue"))
                .header("Authorization", "Bearer api-secret")
                .GET()
                .build();
        assertEquals(405, http.send(get, HttpResponse.BodyHandlers.ofString()).statusCode());
    }

    @Test
    void badHashParameterIsInvalidArgument() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(
                        new URI("http://127.0.0.1:" + port + "/certificates/verify?id=A-1&hash=xyz"))
                .header("X-API-Key", "api-secret")
                .GET()
                .build();
        HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
        assertEquals(400, response.statusCode());
        assertEquals("invalid_argument", mapper.readTree(response.body()).path("error").asText());
    }

    @Test
    void openApiAndMetricsAreServed() throws Exception {
        client.issueCertificate(owner, "M-1", H1, "");

        HttpRequest openapi = HttpRequest.newBuilder(new URI("http://127.0.0.1:" + port + "/openapi.json"))
                .header("Authorization", "Bearer api-secret")
                .GET()
                .build();
        HttpResponse<String> document = http.send(openapi, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, document.statusCode());
        assertTrue(mapper.readTree(document.body()).path("paths").has("/certificates/issue"));

        HttpRequest metrics = HttpRequest.newBuilder(new URI("http://127.0.0.1:" + port + "/metrics"))
                .header("Authorization", "Bearer api-secret")
                .GET()
                .build();
        HttpResponse<String> scrape = http.send(metrics, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, scrape.statusCode());
        assertTrue(scrape.body().contains("registry.certificates.issued"));
    }

    private ObjectNode signedBody(RegistryCall call) {
        ObjectNode body = mapper.createObjectNode()
                .put("registryId", call.registryId())
                .put("caller", call.caller())
                .put("nonce", call.nonce())
                .put("publicKey", Base64.getEncoder().encodeToString(call.publicKey().getEncoded()))
                .put("signature", Base64.getEncoder().encodeToString(call.signature()));
        if (call.subject() != null) {
            body.put("address", call.subject());
        }
        return body;
    }

    private HttpResponse<String> get(String pathAndQuery) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(new URI("http://127.0.0.1:" + port + pathAndQuery))
                .header("Authorization", "Bearer api-secret")
                .GET()
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String payload) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + port + path))
                .header("Authorization", "Bearer api-secret")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
