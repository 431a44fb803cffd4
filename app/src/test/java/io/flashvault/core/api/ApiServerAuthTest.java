package io.flashvault.core.api;

import io.flashvault.core.asset.InMemoryShareToken;
import io.flashvault.core.protocol.Address;
import io.flashvault.core.vault.Vault;
import io.flashvault.core.vault.VaultConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.junit.jupiter.api.Assertions.*;

class ApiServerAuthTest {

    private ApiServer server;
    private Vault vault;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (vault != null) {
            vault.close();
        }
    }

    @Test
    void statusEndpointRequiresAuth() throws Exception {
        int port = freePort();
        vault = Vault.inMemory(VaultConfig.defaultLocal(), new InMemoryShareToken());
        vault.registerApp(vault.owner(), Address.of("exchange"));

        server = new ApiServer(vault, "127.0.0.1", port, "secret-token");
        server.start();

        HttpClient client = HttpClient.newHttpClient();

        URI uri = new URI("http://127.0.0.1:" + port + "/status");
        HttpResponse<String> unauthorized = client.send(HttpRequest.newBuilder(uri).GET().build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(401, unauthorized.statusCode());
        assertTrue(unauthorized.headers().firstValue("WWW-Authenticate").isPresent());

        HttpRequest authorizedRequest = HttpRequest.newBuilder(uri)
                .header("Authorization", "Bearer secret-token")
                .GET()
                .build();
        HttpResponse<String> authorized = client.send(authorizedRequest, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, authorized.statusCode());
        assertTrue(authorized.body().contains("\"unsettledDeltas\":0"));

        HttpRequest apiKeyRequest = HttpRequest.newBuilder(new URI("http://127.0.0.1:" + port + "/metrics"))
                .header("X-API-Key", "secret-token")
                .GET()
                .build();
        HttpResponse<String> metrics = client.send(apiKeyRequest, HttpResponse.BodyHandlers.ofString());
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("vault.apps.registered"));

        HttpResponse<String> wrongKey = client.send(HttpRequest.newBuilder(uri)
                .header("X-API-Key", "nope")
                .GET()
                .build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(401, wrongKey.statusCode());
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }

}
