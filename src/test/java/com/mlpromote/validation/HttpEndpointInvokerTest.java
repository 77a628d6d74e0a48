package com.mlpromote.validation;

import java.io.IOException;
import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.mlpromote.serving.EndpointStatus;
import com.mlpromote.serving.ServingEndpointHandle;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpEndpointInvokerTest {
    private MockWebServer server;
    private HttpEndpointInvoker invoker;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        invoker = HttpEndpointInvoker.create(Duration.ofSeconds(2), Duration.ofSeconds(2), "text/csv");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldPostPayloadAndReturnTrimmedPrediction() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(" 1\n"));

        InvocationResult result = invoker.invoke(handle(server.url("/invocations").toString()), "6.2,2.9,4.3,1.3");

        assertEquals("1", result.prediction());
        assertTrue(result.latencyMs() >= 0.0);
        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/invocations", request.getPath());
        assertEquals("6.2,2.9,4.3,1.3", request.getBody().readUtf8());
        assertTrue(request.getHeader("Content-Type").startsWith("text/csv"));
    }

    @Test
    void shouldTreatNonSuccessStatusAsFailedInvocation() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));

        IOException error = assertThrows(IOException.class,
                () -> invoker.invoke(handle(server.url("/invocations").toString()), "x"));

        assertTrue(error.getMessage().contains("503"));
    }

    @Test
    void shouldRejectEndpointWithoutUrl() {
        assertThrows(IOException.class, () -> invoker.invoke(handle(null), "x"));
    }

    private static ServingEndpointHandle handle(String url) {
        return new ServingEndpointHandle("staging-endpoint", "staging", "cfg-1", "v2", url, EndpointStatus.IN_SERVICE);
    }
}
