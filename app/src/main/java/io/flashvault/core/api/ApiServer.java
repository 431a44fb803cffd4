package io.flashvault.core.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.flashvault.core.metrics.VaultMetrics;
import io.flashvault.core.protocol.Address;
import io.flashvault.core.vault.Vault;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only JSON view of the vault ledgers. Amounts are rendered as decimal strings
 * because they exceed the range of JSON numbers.
 */
public final class ApiServer {
    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "Flash Vault Ledger API",
    "version": "1.0.0"
  },
  "paths": {
    "/status": {
      "get": {
        "summary": "Current session holder and unsettled delta count",
        "responses": { "200": { "description": "Status response" }, "401": { "description": "Auth required" } }
      }
    },
    "/delta": {
      "get": {
        "summary": "Settlement delta of a settler for a currency",
        "parameters": [
          { "name": "settler", "in": "query", "required": true, "schema": { "type": "string" } },
          { "name": "currency", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Delta response" },
          "400": { "description": "Missing or invalid parameters" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/reserves": {
      "get": {
        "summary": "Last synced vault reserve of a currency",
        "parameters": [
          { "name": "currency", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Reserve response" },
          "400": { "description": "Missing or invalid parameters" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/apps": {
      "get": {
        "summary": "Registration flag of an app",
        "parameters": [
          { "name": "app", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "App response" },
          "400": { "description": "Missing or invalid parameters" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/apps/reserve": {
      "get": {
        "summary": "Reserve an app holds in the vault for a currency",
        "parameters": [
          { "name": "app", "in": "query", "required": true, "schema": { "type": "string" } },
          { "name": "currency", "in": "query", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "App reserve response" },
          "400": { "description": "Missing or invalid parameters" },
          "401": { "description": "Auth required" }
        }
      }
    },
    "/metrics": {
      "get": {
        "summary": "Plain-text metrics dump",
        "responses": { "200": { "description": "Metrics" }, "401": { "description": "Auth required" } }
      }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final Vault vault;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(Vault vault, String bindAddress, int port, String authToken) {
        this.vault = vault;
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
        server.createContext("/status", new StatusHandler());
        server.createContext("/delta", new DeltaHandler());
        server.createContext("/reserves", new ReservesHandler());
        server.createContext("/apps", new AppsHandler());
        server.createContext("/apps/reserve", new AppReserveHandler());
        server.createContext("/metrics", new MetricsDumpHandler());
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

    /**
     * GET-only, authorized, metered handler. Subclasses produce the response body and return
     * the HTTP status they sent.
     */
    abstract class ReadHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = VaultMetrics.requestStarted();
            int status = 500;
            try {
                if (!"GET".equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use GET for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = respond(exchange);
            } catch (IllegalArgumentException e) {
                status = sendError(exchange, 400, "invalid_parameter", e.getMessage());
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Request to " + path + " failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                VaultMetrics.requestCompleted(sample, path, status);
                exchange.close();
            }
        }

        abstract int respond(HttpExchange exchange) throws IOException;
    }

    final class StatusHandler extends ReadHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            ObjectNode resp = mapper.createObjectNode();
            resp.put("locked", vault.getLocker().isPresent());
            resp.put("locker", vault.getLocker().map(Address::value).orElse(null));
            resp.put("unsettledDeltas", vault.getUnsettledDeltasCount());
            resp.put("owner", vault.owner().value());
            return sendJson(exchange, 200, resp);
        }
    }

    final class DeltaHandler extends ReadHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            String settler = queryParam(exchange, "settler");
            String currency = queryParam(exchange, "currency");
            if (settler == null || settler.isBlank() || currency == null || currency.isBlank()) {
                return sendError(exchange, 400, "missing_parameter", "Query parameters 'settler' and 'currency' are required");
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.put("settler", settler);
            resp.put("currency", currency);
            resp.put("delta", vault.currencyDelta(Address.of(settler), currency).toString());
            return sendJson(exchange, 200, resp);
        }
    }

    final class ReservesHandler extends ReadHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            String currency = queryParam(exchange, "currency");
            if (currency == null || currency.isBlank()) {
                return sendError(exchange, 400, "missing_currency", "Query parameter 'currency' is required");
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.put("currency", currency);
            resp.put("reserve", vault.reservesOfVault(currency).toString());
            return sendJson(exchange, 200, resp);
        }
    }

    final class AppsHandler extends ReadHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            // "/apps" also receives unregistered sub-paths
            if (!"/apps".equals(exchange.getRequestURI().getPath())) {
                return sendError(exchange, 404, "not_found", "Unknown path " + exchange.getRequestURI().getPath());
            }
            String app = queryParam(exchange, "app");
            if (app == null || app.isBlank()) {
                return sendError(exchange, 400, "missing_app", "Query parameter 'app' is required");
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.put("app", app);
            resp.put("registered", vault.isAppRegistered(Address.of(app)));
            return sendJson(exchange, 200, resp);
        }
    }

    final class AppReserveHandler extends ReadHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            String app = queryParam(exchange, "app");
            String currency = queryParam(exchange, "currency");
            if (app == null || app.isBlank() || currency == null || currency.isBlank()) {
                return sendError(exchange, 400, "missing_parameter", "Query parameters 'app' and 'currency' are required");
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.put("app", app);
            resp.put("currency", currency);
            resp.put("reserve", vault.reservesOfApp(Address.of(app), currency).toString());
            return sendJson(exchange, 200, resp);
        }
    }

    final class MetricsDumpHandler extends ReadHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            byte[] body = VaultMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
            return 200;
        }
    }

    final class OpenApiHandler extends ReadHandler {
        @Override
        int respond(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, OPENAPI_SPEC);
        }
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        if (body instanceof byte[] bytes) {
            payload = bytes;
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
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }

    private static String queryParam(HttpExchange exchange, String key) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null || query.isBlank()) {
            return null;
        }
        for (String part : query.split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            String[] kv = part.split("=", 2);
            if (kv.length != 2) {
                continue;
            }
            String k = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            if (key.equals(k)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
