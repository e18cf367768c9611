package com.mimecast.labeller.credentials;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.mimecast.labeller.error.AuthenticationException;
import com.mimecast.labeller.error.TransientConnectionException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for VaultCredentialStore against a MockWebServer speaking the KV v2 API.
 */
class VaultCredentialStoreTest {

    private static final String PRINCIPAL = "user@example.com";
    private static final String PATH = "/v1/secret/data/labeller/credentials/user@example.com";

    private MockWebServer mockWebServer;
    private VaultCredentialStore store;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        store = new VaultCredentialStore.Builder()
                .withAddress(mockWebServer.url("/").toString())
                .withToken("test-token")
                .withTimeout(5)
                .build();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void getReadsSecretKey() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"data\":{\"data\":{\"secret\":\"app-password\"},\"metadata\":{\"version\":3}}}"));

        Optional<Secret> secret = store.get(PRINCIPAL);

        assertEquals("app-password", secret.orElseThrow().reveal());
        RecordedRequest request = mockWebServer.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals(PATH, request.getPath());
        assertEquals("test-token", request.getHeader("X-Vault-Token"));
        assertNull(request.getHeader("X-Vault-Namespace"));
    }

    @Test
    void missingSecretIsEmpty() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(404).setBody("{\"errors\":[]}"));

        assertTrue(store.get(PRINCIPAL).isEmpty());
    }

    @Test
    void deletedVersionIsEmpty() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"data\":{\"data\":null,\"metadata\":{\"deletion_time\":\"2026-01-01T00:00:00Z\"}}}"));

        assertTrue(store.get(PRINCIPAL).isEmpty());
    }

    @Test
    void forbiddenIsAuthenticationFailure() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(403).setBody("{\"errors\":[\"permission denied\"]}"));

        assertThrows(AuthenticationException.class, () -> store.get(PRINCIPAL));
    }

    @Test
    void serverErrorIsTransient() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500));

        assertThrows(TransientConnectionException.class, () -> store.get(PRINCIPAL));
    }

    @Test
    void putWritesSecretUnderData() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"data\":{\"version\":1}}"));

        store.put(PRINCIPAL, Secret.of("new-password"));

        RecordedRequest request = mockWebServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals(PATH, request.getPath());
        JsonObject body = new Gson().fromJson(request.getBody().readUtf8(), JsonObject.class);
        assertEquals("new-password", body.getAsJsonObject("data").get("secret").getAsString());
    }

    @Test
    void deleteToleratesMissingSecret() throws Exception {
        mockWebServer.enqueue(new MockResponse().setResponseCode(404));

        store.delete(PRINCIPAL);

        assertEquals("DELETE", mockWebServer.takeRequest().getMethod());
    }

    @Test
    void namespaceHeaderIsSent() throws Exception {
        VaultCredentialStore namespaced = new VaultCredentialStore.Builder()
                .withAddress(mockWebServer.url("/").toString())
                .withToken("test-token")
                .withNamespace("team-a")
                .build();
        mockWebServer.enqueue(new MockResponse().setResponseCode(404));

        namespaced.get(PRINCIPAL);

        assertEquals("team-a", mockWebServer.takeRequest().getHeader("X-Vault-Namespace"));
    }
}
