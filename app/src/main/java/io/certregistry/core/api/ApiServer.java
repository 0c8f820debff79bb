package io.certregistry.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.certregistry.core.event.EventJournal;
import io.certregistry.core.event.RegistryEvent;
import io.certregistry.core.metrics.HttpMetrics;
import io.certregistry.core.metrics.RegistryMetrics;
import io.certregistry.core.node.RegistryNode;
import io.certregistry.core.protocol.Address;
import io.certregistry.core.protocol.CertHash;
import io.certregistry.core.protocol.RegistryCall;
import io.certregistry.core.protocol.SignatureUtil;
import io.certregistry.core.registry.CertificateRecord;
import io.certregistry.core.registry.RegistryException;
import io.certregistry.core.registry.VerificationResult;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class ApiServer {
    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "Certificate Registry API",
    "version": "1.0.0"
  },
  "paths": {
    "/certificates": {
      "get": {
        "summary": "Fetch the full record of a certificate",
        "parameters": [
          { "name": "id", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Certificate record" },
          "404": { "description": "No certificate with this identifier" }
        }
      }
    },
    "/certificates/issue": {
      "post": {
        "summary": "Issue a certificate (signed call by an authorized issuer)",
        "requestBody": {
          "required": true,
          "content": { "application/json": { "schema": { "$ref": "#/components/schemas/SignedCall" } } }
        },
        "responses": {
          "200": { "description": "Certificate issued" },
          "400": { "description": "Invalid argument or nonce" },
          "403": { "description": "Caller not authorized" },
          "409": { "description": "Certificate already exists" }
        }
      }
    },
    "/certificates/revoke": {
      "post": {
        "summary": "Revoke a certificate (signed call by its issuer or the owner)",
        "requestBody": {
          "required": true,
          "content": { "application/json": { "schema": { "$ref": "#/components/schemas/SignedCall" } } }
        },
        "responses": {
          "200": { "description": "Certificate revoked" },
          "403": { "description": "Caller not authorized" },
          "404": { "description": "Certificate not found" },
          "409": { "description": "Certificate already revoked" }
        }
      }
    },
    "/certificates/verify": {
      "get": {
        "summary": "True only for an existing, unrevoked certificate with this hash",
        "parameters": [
          { "name": "id", "in": "query", "required": true, "schema": { "type": "string" } },
          { "name": "hash", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": { "200": { "description": "Verification result" }, "400": { "description": "Malformed hash" } }
      }
    },
    "/certificates/diagnose": {
      "get": {
        "summary": "Diagnostic verification: VALID, NOT_FOUND, HASH_MISMATCH or REVOKED",
        "parameters": [
          { "name": "id", "in": "query", "required": true, "schema": { "type": "string" } },
          { "name": "hash", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": { "200": { "description": "Diagnostic result" }, "400": { "description": "Malformed hash" } }
      }
    },
    "/issuers": {
      "get": {
        "summary": "Authorization flag of one address, or the list of authorized issuers",
        "parameters": [
          { "name": "address", "in": "query", "required": false, "schema": { "type": "string" } }
        ],
        "responses": { "200": { "description": "Issuer information" } }
      }
    },
    "/issuers/add": {
      "post": {
        "summary": "Authorize an issuer (signed call by the owner)",
        "requestBody": {
          "required": true,
          "content": { "application/json": { "schema": { "$ref": "#/components/schemas/SignedCall" } } }
        },
        "responses": { "200": { "description": "Issuer added" }, "400": { "description": "Invalid address" }, "403": { "description": "Caller is not the owner" } }
      }
    },
    "/issuers/remove": {
      "post": {
        "summary": "Deauthorize an issuer (signed call by the owner)",
        "requestBody": {
          "required": true,
          "content": { "application/json": { "schema": { "$ref": "#/components/schemas/SignedCall" } } }
        },
        "responses": { "200": { "description": "Issuer removed" }, "403": { "description": "Caller is not the owner" } }
      }
    },
    "/nonce": {
      "get": {
        "summary": "Next call nonce of a principal",
        "parameters": [
          { "name": "address", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": { "200": { "description": "Nonce" } }
      }
    },
    "/status": {
      "get": {
        "summary": "Owner, registry id, counts and journal head",
        "responses": { "200": { "description": "Status response" } }
      }
    },
    "/events": {
      "get": {
        "summary": "Recent registry events after a sequence number",
        "parameters": [
          { "name": "since", "in": "query", "required": false, "schema": { "type": "integer", "format": "int64" } }
        ],
        "responses": { "200": { "description": "Event list" } }
      }
    },
    "/metrics": {
      "get": {
        "summary": "Metrics scrape",
        "responses": { "200": { "description": "Metrics in plain text" } }
      }
    },
    "/openapi.json": {
      "get": {
        "summary": "Return this OpenAPI document",
        "responses": { "200": { "description": "OpenAPI document" } }
      }
    }
  },
  "components": {
    "schemas": {
      "SignedCall": {
        "type": "object",
        "required": ["registryId", "caller", "nonce", "publicKey", "signature"],
        "properties": {
          "registryId": { "type": "string", "description": "Registry id from /status; part of the signed bytes" },
          "caller": { "type": "string", "description": "40 hex character principal address" },
          "nonce": { "type": "integer", "format": "int64" },
          "certId": { "type": "string" },
          "certHash": { "type": "string", "description": "64 hex characters" },
          "ipfsCid": { "type": "string" },
          "address": { "type": "string", "description": "Issuer address for /issuers/add and /issuers/remove" },
          "publicKey": { "type": "string", "format": "byte", "description": "X.509 encoded EC public key" },
          "signature": { "type": "string", "format": "byte", "description": "SHA256withECDSA over the canonical call bytes" }
        }
      }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final RegistryNode node;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(RegistryNode node, String bindAddress, int port, String authToken) {
        this.node = node;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("API server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/certificates", new CertificateHandler());
        server.createContext("/certificates/issue", new CallHandler(RegistryCall.Operation.ISSUE_CERTIFICATE));
        server.createContext("/certificates/revoke", new CallHandler(RegistryCall.Operation.REVOKE_CERTIFICATE));
        server.createContext("/certificates/verify", new VerifyHandler(false));
        server.createContext("/certificates/diagnose", new VerifyHandler(true));
        server.createContext("/issuers", new IssuersHandler());
        server.createContext("/issuers/add", new CallHandler(RegistryCall.Operation.ADD_ISSUER));
        server.createContext("/issuers/remove", new CallHandler(RegistryCall.Operation.REMOVE_ISSUER));
        server.createContext("/nonce", new NonceHandler());
        server.createContext("/status", new StatusHandler());
        server.createContext("/events", new EventsHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/openapi.json", new OpenApiHandler());
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "API server listening on http://" + bindAddress + ':' + port + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    /**
     * Shared request plumbing: exact path, HTTP method, optional API token,
     * exception mapping and request timing.
     */
    abstract class JsonHandler implements HttpHandler {
        private final String allowedMethod;

        JsonHandler(String allowedMethod) {
            this.allowedMethod = allowedMethod;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String route = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!route.equals(exchange.getRequestURI().getPath())) {
                    status = sendError(exchange, 404, "not_found", "No such endpoint");
                    return;
                }
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = respond(exchange);
            } catch (RegistryException e) {
                status = sendError(exchange, statusFor(e.reason()), errorCode(e.reason()), e.getMessage());
            } catch (IllegalArgumentException e) {
                status = sendError(exchange, 400, "invalid_argument",
                        Optional.ofNullable(e.getMessage()).orElse("Invalid request"));
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Handler for " + route + " failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, method, route, status);
                exchange.close();
            }
        }

        abstract int respond(HttpExchange exchange) throws IOException;
    }

    final class CertificateHandler extends JsonHandler {
        CertificateHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            String certId = queryParam(exchange.getRequestURI(), "id");
            if (certId == null || certId.isEmpty()) {
                return sendError(exchange, 400, "missing_id", "Query parameter 'id' is required");
            }
            CertificateRecord record = node.registry().getCertificate(certId);
            return sendJson(exchange, 200, recordJson(record));
        }
    }

    final class VerifyHandler extends JsonHandler {
        private final boolean diagnostic;

        VerifyHandler(boolean diagnostic) {
            super("GET");
            this.diagnostic = diagnostic;
        }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            String certId = queryParam(exchange.getRequestURI(), "id");
            String hash = queryParam(exchange.getRequestURI(), "hash");
            if (certId == null || hash == null) {
                return sendError(exchange, 400, "missing_parameters", "Query parameters 'id' and 'hash' are required");
            }
            CertHash certHash = CertHash.fromHex(hash);
            ObjectNode resp = mapper.createObjectNode().put("certId", certId);
            if (diagnostic) {
                VerificationResult result = node.registry().diagnoseCertificate(certId, certHash);
                resp.put("result", result.name());
                resp.put("valid", result.isValid());
            } else {
                resp.put("valid", node.registry().verifyCertificate(certId, certHash));
            }
            return sendJson(exchange, 200, resp);
        }
    }

    final class CallHandler extends JsonHandler {
        private final RegistryCall.Operation operation;

        CallHandler(RegistryCall.Operation operation) {
            super("POST");
            this.operation = operation;
        }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            CallRequest req;
            try {
                req = mapper.readValue(exchange.getRequestBody(), CallRequest.class);
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse call request");
            }
            if (req == null || req.caller == null || req.caller.isBlank()) {
                return sendError(exchange, 400, "missing_caller", "Field 'caller' is required");
            }
            if (req.publicKey == null || req.signature == null) {
                return sendError(exchange, 400, "missing_signature", "Fields 'publicKey' and 'signature' are required");
            }
            if (req.registryId == null || req.registryId.isBlank()) {
                return sendError(exchange, 400, "missing_registry_id", "Field 'registryId' is required");
            }
            RegistryCall call = toCall(operation, req);
            Optional<CertificateRecord> result = node.processor().submit(call);

            ObjectNode resp = mapper.createObjectNode();
            resp.put("status", "ok");
            resp.put("operation", operation.name());
            resp.put("nonce", node.processor().nextNonce(call.caller()));
            result.ifPresent(record -> resp.set("certificate", recordJson(record)));
            if (call.subject() != null) {
                resp.put("address", call.subject());
            }
            return sendJson(exchange, 200, resp);
        }
    }

    final class IssuersHandler extends JsonHandler {
        IssuersHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            String address = queryParam(exchange.getRequestURI(), "address");
            if (address != null) {
                ObjectNode resp = mapper.createObjectNode()
                        .put("address", address)
                        .put("authorized", node.registry().isIssuer(address))
                        .put("owner", Address.normalize(address).equals(node.registry().owner()));
                return sendJson(exchange, 200, resp);
            }
            ArrayNode array = mapper.createArrayNode();
            for (String issuer : node.registry().issuers()) {
                array.add(issuer);
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.set("issuers", array);
            return sendJson(exchange, 200, resp);
        }
    }

    final class NonceHandler extends JsonHandler {
        NonceHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            String address = queryParam(exchange.getRequestURI(), "address");
            if (address == null || address.isBlank()) {
                return sendError(exchange, 400, "missing_address", "Query parameter 'address' is required");
            }
            ObjectNode resp = mapper.createObjectNode()
                    .put("address", address)
                    .put("nonce", node.processor().nextNonce(address));
            return sendJson(exchange, 200, resp);
        }
    }

    final class StatusHandler extends JsonHandler {
        StatusHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            ObjectNode resp = mapper.createObjectNode();
            resp.put("owner", node.registry().owner());
            resp.put("registryId", node.registry().registryId());
            resp.put("certificates", node.registry().certificateCount());
            resp.put("issuers", node.registry().issuers().size());
            resp.put("lastEvent", node.journal().lastSequence());
            return sendJson(exchange, 200, resp);
        }
    }

    final class EventsHandler extends JsonHandler {
        EventsHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            String sinceParam = queryParam(exchange.getRequestURI(), "since");
            long since = 0L;
            if (sinceParam != null && !sinceParam.isBlank()) {
                try {
                    since = Long.parseLong(sinceParam);
                } catch (NumberFormatException e) {
                    return sendError(exchange, 400, "invalid_since", "Query parameter 'since' must be an integer");
                }
            }
            List<EventJournal.Entry> entries = node.journal().since(since);
            ArrayNode array = mapper.createArrayNode();
            for (EventJournal.Entry entry : entries) {
                array.add(eventJson(entry));
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.put("lastSequence", node.journal().lastSequence());
            resp.set("events", array);
            return sendJson(exchange, 200, resp);
        }
    }

    final class MetricsHandler extends JsonHandler {
        MetricsHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            byte[] payload = RegistryMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
            exchange.sendResponseHeaders(200, payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
            return 200;
        }
    }

    final class OpenApiHandler extends JsonHandler {
        OpenApiHandler() { super("GET"); }

        @Override
        int respond(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, OPENAPI_SPEC);
        }
    }

    /** Wire form of a signed call; field names shared with {@code RegistryClient}. */
    public static class CallRequest {
        public String registryId;
        public String caller;
        public long nonce;
        public String certId;
        public String certHash;
        public String ipfsCid;
        public String address;
        public String publicKey;
        public String signature;
    }

    static RegistryCall toCall(RegistryCall.Operation operation, CallRequest req) {
        Base64.Decoder b64 = Base64.getDecoder();
        return RegistryCall.builder()
                .registryId(req.registryId)
                .operation(operation)
                .caller(req.caller)
                .nonce(req.nonce)
                .certId(req.certId)
                .certHash(req.certHash == null || req.certHash.isBlank() ? null : CertHash.fromHex(req.certHash))
                .ipfsCid(req.ipfsCid)
                .subject(req.address)
                .publicKey(SignatureUtil.decodePublicKey(b64.decode(req.publicKey)))
                .signature(b64.decode(req.signature))
                .build();
    }

    static int statusFor(RegistryException.Reason reason) {
        switch (reason) {
            case AUTHORIZATION: return 403;
            case INVALID_ARGUMENT: return 400;
            case NOT_FOUND: return 404;
            case ALREADY_EXISTS:
            case ALREADY_REVOKED: return 409;
            default: return 500;
        }
    }

    static String errorCode(RegistryException.Reason reason) {
        return reason.name().toLowerCase(Locale.ROOT);
    }

    private ObjectNode recordJson(CertificateRecord record) {
        return mapper.createObjectNode()
                .put("certId", record.certId())
                .put("certHash", record.certHash().hex())
                .put("ipfsCid", record.ipfsCid())
                .put("issuedBy", record.issuedBy())
                .put("issuedAt", record.issuedAt())
                .put("revoked", record.revoked())
                .put("status", record.status().name());
    }

    private ObjectNode eventJson(EventJournal.Entry entry) {
        RegistryEvent event = entry.event();
        ObjectNode json = mapper.createObjectNode()
                .put("sequence", entry.sequence())
                .put("recordedAt", entry.recordedAt())
                .put("type", event.type());
        if (event instanceof RegistryEvent.IssuerAdded added) {
            json.put("issuer", added.issuer());
        } else if (event instanceof RegistryEvent.IssuerRemoved removed) {
            json.put("issuer", removed.issuer());
        } else if (event instanceof RegistryEvent.CertificateIssued issued) {
            json.put("certId", issued.certId())
                    .put("certHash", issued.certHash().hex())
                    .put("ipfsCid", issued.ipfsCid())
                    .put("issuer", issued.issuer());
        } else if (event instanceof RegistryEvent.CertificateRevoked revoked) {
            json.put("certId", revoked.certId())
                    .put("revoker", revoked.revoker());
        }
        return json;
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        if (body instanceof byte[] bytes) {
            payload = bytes;
        } else if (body instanceof String str) {
            payload = str.getBytes(StandardCharsets.UTF_8);
        } else {
            payload = mapper.writeValueAsBytes(body);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode body = mapper.createObjectNode();
        body.put("error", code);
        body.put("message", message);
        return sendJson(exchange, status, body);
    }

    private static String queryParam(URI uri, String name) {
        String query = uri.getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            String[] kv = pair.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String key = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (name.equals(key)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
