package io.certregistry.core.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.certregistry.core.protocol.CertHash;
import io.certregistry.core.protocol.RegistryCall;
import io.certregistry.core.registry.CertificateRecord;
import io.certregistry.core.registry.RegistryException;
import io.certregistry.core.registry.VerificationResult;
import io.certregistry.core.wallet.Wallet;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * HTTP client for the registry API. State-changing calls are signed with the
 * given wallet for the server's registry id, using the caller's current
 * nonce from the server.
 * <p>
 * Error responses that carry a registry reason are rethrown as
 * {@link RegistryException}; transport and other failures surface as
 * {@link IllegalStateException}.
 */
public class RegistryClient {

    private final HttpClient http;
    private final String baseUrl;
    private final String apiToken;
    private final ObjectMapper mapper;
    private volatile String registryId;

    public RegistryClient(String baseUrl) {
        this(baseUrl, null);
    }

    public RegistryClient(String baseUrl, String apiToken) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiToken = (apiToken == null || apiToken.isBlank()) ? null : apiToken;
        this.http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public CertificateRecord issueCertificate(Wallet issuer, String certId, CertHash certHash, String ipfsCid) {
        RegistryCall call = RegistryCall.issue(registryId(), issuer.getAddress(), nonce(issuer.getAddress()), certId, certHash, ipfsCid).build();
        return toRecord(post("/certificates/issue", issuer.sign(call)).get("certificate"));
    }

    public CertificateRecord revokeCertificate(Wallet caller, String certId) {
        RegistryCall call = RegistryCall.revoke(registryId(), caller.getAddress(), nonce(caller.getAddress()), certId).build();
        return toRecord(post("/certificates/revoke", caller.sign(call)).get("certificate"));
    }

    public void addIssuer(Wallet owner, String address) {
        RegistryCall call = RegistryCall.addIssuer(registryId(), owner.getAddress(), nonce(owner.getAddress()), address).build();
        post("/issuers/add", owner.sign(call));
    }

    public void removeIssuer(Wallet owner, String address) {
        RegistryCall call = RegistryCall.removeIssuer(registryId(), owner.getAddress(), nonce(owner.getAddress()), address).build();
        post("/issuers/remove", owner.sign(call));
    }

    public boolean verifyCertificate(String certId, CertHash certHash) {
        JsonNode resp = get("/certificates/verify?id=" + encode(certId) + "&hash=" + certHash.hex());
        return resp.path("valid").asBoolean(false);
    }

    public VerificationResult diagnoseCertificate(String certId, CertHash certHash) {
        JsonNode resp = get("/certificates/diagnose?id=" + encode(certId) + "&hash=" + certHash.hex());
        return VerificationResult.valueOf(resp.path("result").asText());
    }

    public CertificateRecord getCertificate(String certId) {
        return toRecord(get("/certificates?id=" + encode(certId)));
    }

    public boolean isIssuer(String address) {
        return get("/issuers?address=" + encode(address)).path("authorized").asBoolean(false);
    }

    public List<String> issuers() {
        List<String> out = new ArrayList<>();
        for (JsonNode n : get("/issuers").path("issuers")) {
            out.add(n.asText());
        }
        return out;
    }

    public long nonce(String address) {
        return get("/nonce?address=" + encode(address)).path("nonce").asLong();
    }

    public JsonNode status() {
        return get("/status");
    }

    /** Registry id reported by {@code /status}, fetched once. */
    public String registryId() {
        String id = registryId;
        if (id == null) {
            id = status().path("registryId").asText("");
            if (id.isEmpty()) {
                throw new IllegalStateException("Server at " + baseUrl + " reports no registry id");
            }
            registryId = id;
        }
        return id;
    }

    public JsonNode events(long since) {
        return get("/events?since=" + since);
    }

    private JsonNode post(String path, RegistryCall call) {
        ObjectNode body = mapper.createObjectNode();
        body.put("registryId", call.registryId());
        body.put("caller", call.caller());
        body.put("nonce", call.nonce());
        if (call.certId() != null) body.put("certId", call.certId());
        if (call.certHash() != null) body.put("certHash", call.certHash().hex());
        if (call.ipfsCid() != null) body.put("ipfsCid", call.ipfsCid());
        if (call.subject() != null) body.put("address", call.subject());
        body.put("publicKey", Base64.getEncoder().encodeToString(call.publicKey().getEncoded()));
        body.put("signature", Base64.getEncoder().encodeToString(call.signature()));
        HttpRequest.Builder request = request(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8));
        return send(request.build());
    }

    private JsonNode get(String pathAndQuery) {
        return send(request(pathAndQuery).GET().build());
    }

    private HttpRequest.Builder request(String pathAndQuery) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + pathAndQuery))
                .timeout(Duration.ofSeconds(10));
        if (apiToken != null) {
            builder.header("Authorization", "Bearer " + apiToken);
        }
        return builder;
    }

    private JsonNode send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new IllegalStateException("Request to " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while calling " + request.uri(), e);
        }
        JsonNode body;
        try {
            body = mapper.readTree(response.body());
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable response from " + request.uri() + " (HTTP " + response.statusCode() + ")", e);
        }
        if (response.statusCode() / 100 != 2) {
            String code = body.path("error").asText("");
            String message = body.path("message").asText("HTTP " + response.statusCode());
            for (RegistryException.Reason reason : RegistryException.Reason.values()) {
                if (reason.name().toLowerCase(Locale.ROOT).equals(code)) {
                    throw new RegistryException(reason, message);
                }
            }
            throw new IllegalStateException("HTTP " + response.statusCode() + " " + code + ": " + message);
        }
        return body;
    }

    private static CertificateRecord toRecord(JsonNode json) {
        if (json == null || json.isMissingNode() || json.isNull()) {
            throw new IllegalStateException("Response carries no certificate");
        }
        return new CertificateRecord(
                json.path("certId").asText(),
                CertHash.fromHex(json.path("certHash").asText()),
                json.path("ipfsCid").asText(""),
                json.path("issuedBy").asText(),
                json.path("issuedAt").asLong(),
                json.path("revoked").asBoolean());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
