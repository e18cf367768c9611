package com.mimecast.labeller.batch;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.mimecast.labeller.config.ClassifierConfig;
import com.mimecast.labeller.error.AuthenticationException;
import com.mimecast.labeller.error.RateLimitedException;
import com.mimecast.labeller.error.TransientConnectionException;
import com.mimecast.labeller.error.ValidationException;
import com.mimecast.labeller.session.MailItem;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Classification service client over HTTP/JSON.
 *
 * <p>Request:
 * <pre>
 * {"items":[{"id":"42","subject":"...","from":"...","text":"..."}],"labels":["Finance","Travel"]}
 * </pre>
 * <p>Response:
 * <pre>
 * {"results":[{"item_ref":"42","label":"Finance","confidence":0.91}]}
 * </pre>
 */
public class HttpClassifier implements Classifier {
    private static final Logger log = LogManager.getLogger(HttpClassifier.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final long DEFAULT_RETRY_AFTER_SECONDS = 1;

    private final String endpoint;
    private final String apiToken;
    private final int maxTextLength;
    private final OkHttpClient httpClient;
    private final Gson gson = new Gson();

    public HttpClassifier(ClassifierConfig config) {
        if (StringUtils.isBlank(config.getEndpoint())) {
            throw new ValidationException("Classifier endpoint is not configured");
        }
        this.endpoint = config.getEndpoint();
        this.apiToken = config.getApiToken();
        this.maxTextLength = config.getMaxTextLength();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .readTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .writeTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS)
                .build();
        log.debug("Classifier client initialized for {}", endpoint);
    }

    @Override
    public List<Classification> classify(List<MailItem> items, List<String> labels) {
        if (items.isEmpty()) {
            return new ArrayList<>();
        }

        Request.Builder builder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(gson.toJson(payload(items, labels)), JSON));
        if (StringUtils.isNotBlank(apiToken)) {
            builder.header("Authorization", "Bearer " + apiToken);
        }

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            if (response.code() == 429) {
                long retryAfter = retryAfter(response.header("Retry-After"));
                throw new RateLimitedException("Classifier throttled the request", retryAfter, true);
            }
            if (response.code() == 401 || response.code() == 403) {
                throw new AuthenticationException("Classifier rejected the API token: HTTP " + response.code());
            }
            if (!response.isSuccessful()) {
                throw new TransientConnectionException("Classifier request failed: HTTP " + response.code());
            }

            String body = response.body() != null ? response.body().string() : "{}";
            List<Classification> results = parse(body);
            log.debug("Classified {} items into {} results", items.size(), results.size());
            return results;
        } catch (IOException e) {
            throw new TransientConnectionException("Classifier request failed: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> payload(List<MailItem> items, List<String> labels) {
        List<Map<String, String>> rows = new ArrayList<>();
        for (MailItem item : items) {
            Map<String, String> row = new HashMap<>();
            row.put("id", item.getId());
            row.put("subject", item.getSubject());
            row.put("from", item.getFrom());
            row.put("text", StringUtils.truncate(item.getText(), maxTextLength));
            rows.add(row);
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("items", rows);
        payload.put("labels", labels);
        return payload;
    }

    private List<Classification> parse(String body) {
        List<Classification> results = new ArrayList<>();
        try {
            JsonObject json = gson.fromJson(body, JsonObject.class);
            if (json == null || !json.has("results") || !json.get("results").isJsonArray()) {
                throw new TransientConnectionException("Classifier response has no results array");
            }
            JsonArray array = json.getAsJsonArray("results");
            for (JsonElement element : array) {
                JsonObject row = element.getAsJsonObject();
                if (!row.has("item_ref") || !row.has("label") || !row.has("confidence")) {
                    log.warn("Skipping incomplete classifier result: {}", row);
                    continue;
                }
                double confidence = row.get("confidence").getAsDouble();
                if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
                    log.warn("Skipping classifier result with confidence {}", confidence);
                    continue;
                }
                results.add(new Classification(
                        row.get("item_ref").getAsString(),
                        row.get("label").getAsString(),
                        confidence));
            }
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
            throw new TransientConnectionException("Classifier returned malformed JSON: " + e.getMessage(), e);
        }
        return results;
    }

    private static long retryAfter(String header) {
        if (StringUtils.isBlank(header)) {
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
        try {
            return Math.max(0, Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            log.debug("Unparseable Retry-After header: {}", header);
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
    }
}
