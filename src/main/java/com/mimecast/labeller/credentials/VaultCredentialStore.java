package com.mimecast.labeller.credentials;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonSyntaxException;
import com.mimecast.labeller.config.VaultConfig;
import com.mimecast.labeller.error.AuthenticationException;
import com.mimecast.labeller.error.TransientConnectionException;
import com.mimecast.labeller.util.Principals;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Credential store backed by a HashiCorp Vault KV v2 engine.
 *
 * <p>Each principal has one secret at {@code <mount>/data/<prefix>/<principal>} holding a
 * single {@code secret} key.
 * <p>Example usage:
 * <pre>
 * CredentialStore store = new VaultCredentialStore.Builder()
 *     .withAddress("https://vault.example.com:8200")
 *     .withToken("s.abc123xyz")
 *     .build();
 *
 * Optional&lt;Secret&gt; secret = store.get("user@example.com");
 * </pre>
 */
public class VaultCredentialStore implements CredentialStore {
    private static final Logger log = LogManager.getLogger(VaultCredentialStore.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String SECRET_KEY = "secret";

    private final HttpUrl address;
    private final String token;
    private final String namespace;
    private final String mount;
    private final String pathPrefix;
    private final OkHttpClient httpClient;
    private final Gson gson = new Gson();

    private VaultCredentialStore(Builder builder) {
        this.address = HttpUrl.get(builder.address);
        this.token = builder.token;
        this.namespace = builder.namespace;
        this.mount = builder.mount;
        this.pathPrefix = builder.pathPrefix;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(builder.timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(builder.timeoutSeconds, TimeUnit.SECONDS)
                .writeTimeout(builder.timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    /**
     * Builds a store from configuration.
     *
     * @param config VaultConfig instance.
     * @return VaultCredentialStore instance.
     */
    public static VaultCredentialStore from(VaultConfig config) {
        return new Builder()
                .withAddress(config.getAddress())
                .withToken(config.getToken())
                .withNamespace(config.getNamespace())
                .withMount(config.getMount())
                .withPathPrefix(config.getPathPrefix())
                .withTimeout(config.getTimeoutSeconds())
                .build();
    }

    @Override
    public Optional<Secret> get(String principal) {
        Request request = request(principal).get().build();
        log.debug("Fetching credential for {}", Principals.hash(principal));

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                return Optional.empty();
            }
            check(response, "read");

            String body = response.body() != null ? response.body().string() : "{}";
            JsonObject json = gson.fromJson(body, JsonObject.class);
            if (json == null || !json.has("data") || !json.getAsJsonObject("data").has("data")
                    || json.getAsJsonObject("data").get("data").isJsonNull()) {
                return Optional.empty();
            }

            JsonElement value = json.getAsJsonObject("data").getAsJsonObject("data").get(SECRET_KEY);
            if (value == null || value.isJsonNull() || value.getAsString().isEmpty()) {
                log.warn("Vault secret for {} has no '{}' key", Principals.hash(principal), SECRET_KEY);
                return Optional.empty();
            }
            return Optional.of(Secret.of(value.getAsString()));
        } catch (JsonSyntaxException e) {
            throw new TransientConnectionException("Vault returned malformed JSON", e);
        } catch (IOException e) {
            throw new TransientConnectionException("Failed to read credential from Vault: " + e.getMessage(), e);
        }
    }

    @Override
    public void put(String principal, Secret secret) {
        Map<String, String> data = new HashMap<>();
        data.put(SECRET_KEY, secret.reveal());
        Map<String, Object> payload = new HashMap<>();
        payload.put("data", data);

        Request request = request(principal).post(RequestBody.create(gson.toJson(payload), JSON)).build();
        try (Response response = httpClient.newCall(request).execute()) {
            check(response, "write");
            log.info("Stored credential for {}", Principals.hash(principal));
        } catch (IOException e) {
            throw new TransientConnectionException("Failed to write credential to Vault: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(String principal) {
        Request request = request(principal).delete().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                return;
            }
            check(response, "delete");
            log.info("Deleted credential for {}", Principals.hash(principal));
        } catch (IOException e) {
            throw new TransientConnectionException("Failed to delete credential from Vault: " + e.getMessage(), e);
        }
    }

    private Request.Builder request(String principal) {
        Objects.requireNonNull(principal, "principal must not be null");
        HttpUrl url = address.newBuilder()
                .addPathSegment("v1")
                .addPathSegment(mount)
                .addPathSegment("data")
                .addPathSegments(pathPrefix)
                .addPathSegment(principal)
                .build();

        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("X-Vault-Token", token);
        if (namespace != null && !namespace.isEmpty()) {
            builder.header("X-Vault-Namespace", namespace);
        }
        return builder;
    }

    private static void check(Response response, String operation) {
        if (response.isSuccessful()) {
            return;
        }
        String message = "Vault " + operation + " failed with status: " + response.code();
        if (response.code() == 401 || response.code() == 403) {
            throw new AuthenticationException(message);
        }
        throw new TransientConnectionException(message);
    }

    /**
     * Builder for VaultCredentialStore.
     */
    public static class Builder {
        private String address;
        private String token;
        private String namespace;
        private String mount = "secret";
        private String pathPrefix = "labeller/credentials";
        private int timeoutSeconds = 30;

        public Builder withAddress(String address) {
            this.address = address;
            return this;
        }

        public Builder withToken(String token) {
            this.token = token;
            return this;
        }

        /**
         * Sets the Vault namespace (for Vault Enterprise).
         *
         * @param namespace Vault namespace.
         * @return Builder instance.
         */
        public Builder withNamespace(String namespace) {
            this.namespace = namespace;
            return this;
        }

        public Builder withMount(String mount) {
            this.mount = mount;
            return this;
        }

        public Builder withPathPrefix(String pathPrefix) {
            this.pathPrefix = pathPrefix;
            return this;
        }

        public Builder withTimeout(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        /**
         * Builds the store.
         *
         * @return VaultCredentialStore instance.
         * @throws NullPointerException if address or token is missing.
         */
        public VaultCredentialStore build() {
            Objects.requireNonNull(address, "address must not be null");
            Objects.requireNonNull(token, "token must not be null");
            return new VaultCredentialStore(this);
        }
    }
}
