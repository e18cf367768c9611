package com.mimecast.labeller.batch;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.mimecast.labeller.config.ClassifierConfig;
import com.mimecast.labeller.error.AuthenticationException;
import com.mimecast.labeller.error.RateLimitedException;
import com.mimecast.labeller.error.TransientConnectionException;
import com.mimecast.labeller.error.ValidationException;
import com.mimecast.labeller.session.MailItem;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for HttpClassifier against a MockWebServer standing in for the classification service.
 */
class HttpClassifierTest {

    private static final List<String> LABELS = List.of("Finance", "Travel");

    private MockWebServer mockWebServer;
    private HttpClassifier classifier;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        Map<String, Object> map = new HashMap<>();
        map.put("endpoint", mockWebServer.url("/classify").toString());
        map.put("apiToken", "test-token");
        map.put("maxTextLength", 10);
        map.put("timeoutSeconds", 5);
        classifier = new HttpClassifier(new ClassifierConfig(map));
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void postsItemsAndParsesResults() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("{\"results\":[" +
                        "{\"item_ref\":\"42\",\"label\":\"Finance\",\"confidence\":0.91}," +
                        "{\"item_ref\":\"42\",\"label\":\"Travel\",\"confidence\":0.2}]}"));

        List<Classification> results = classifier.classify(List.of(item("42")), LABELS);

        assertEquals(2, results.size());
        assertEquals("42", results.get(0).getItemRef());
        assertEquals("Finance", results.get(0).getLabel());
        assertEquals(0.91, results.get(0).getConfidence(), 1e-9);

        RecordedRequest request = mockWebServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/classify", request.getPath());
        assertEquals("Bearer test-token", request.getHeader("Authorization"));

        JsonObject body = new Gson().fromJson(request.getBody().readUtf8(), JsonObject.class);
        assertEquals(2, body.getAsJsonArray("labels").size());
        JsonObject sent = body.getAsJsonArray("items").get(0).getAsJsonObject();
        assertEquals("42", sent.get("id").getAsString());
        assertEquals("Trip to Lisbon", sent.get("subject").getAsString());
        assertEquals(10, sent.get("text").getAsString().length());
    }

    @Test
    void skipsIncompleteAndOutOfRangeResults() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"results\":[" +
                        "{\"item_ref\":\"1\",\"label\":\"Finance\"}," +
                        "{\"item_ref\":\"1\",\"label\":\"Finance\",\"confidence\":1.5}," +
                        "{\"item_ref\":\"1\",\"label\":\"Travel\",\"confidence\":0.6}]}"));

        List<Classification> results = classifier.classify(List.of(item("1")), LABELS);

        assertEquals(1, results.size());
        assertEquals("Travel", results.get(0).getLabel());
    }

    @Test
    void skipsNotANumberConfidence() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"results\":[" +
                        "{\"item_ref\":\"1\",\"label\":\"Finance\",\"confidence\":\"NaN\"}," +
                        "{\"item_ref\":\"1\",\"label\":\"Travel\",\"confidence\":0.7}]}"));

        List<Classification> results = classifier.classify(List.of(item("1")), LABELS);

        assertEquals(1, results.size());
        assertEquals("Travel", results.get(0).getLabel());
    }

    @Test
    void nonNumericConfidenceIsTransient() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"results\":[{\"item_ref\":\"1\",\"label\":\"Finance\",\"confidence\":\"high\"}]}"));

        assertThrows(TransientConnectionException.class, () -> classifier.classify(List.of(item("1")), LABELS));
    }

    @Test
    void emptyInputMakesNoRequest() {
        assertTrue(classifier.classify(List.of(), LABELS).isEmpty());
        assertEquals(0, mockWebServer.getRequestCount());
    }

    @Test
    void throttlingCarriesRetryAfter() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "12"));

        RateLimitedException e = assertThrows(RateLimitedException.class,
                () -> classifier.classify(List.of(item("1")), LABELS));

        assertEquals(12, e.getRemainingSeconds());
        assertTrue(e.isProviderThrottled());
    }

    @Test
    void rejectedTokenIsAuthenticationFailure() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(401));

        assertThrows(AuthenticationException.class, () -> classifier.classify(List.of(item("1")), LABELS));
    }

    @Test
    void serverErrorIsTransient() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(503));

        assertThrows(TransientConnectionException.class, () -> classifier.classify(List.of(item("1")), LABELS));
    }

    @Test
    void malformedBodyIsTransient() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"unexpected\":true}"));

        assertThrows(TransientConnectionException.class, () -> classifier.classify(List.of(item("1")), LABELS));
    }

    @Test
    void blankEndpointIsRejected() {
        Map<String, Object> map = new HashMap<>();
        map.put("endpoint", " ");

        assertThrows(ValidationException.class, () -> new HttpClassifier(new ClassifierConfig(map)));
    }

    private static MailItem item(String id) {
        return new MailItem(id, "Trip to Lisbon", "agent@travel.example", "Your booking reference is ABC123", null);
    }
}
