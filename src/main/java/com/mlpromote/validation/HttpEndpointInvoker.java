package com.mlpromote.validation;

import java.io.IOException;
import java.time.Duration;

import com.mlpromote.serving.ServingEndpointHandle;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Posts the sample payload to the endpoint URL and returns the trimmed response body as the
 * prediction. Non-2xx responses count as failed invocations.
 */
public class HttpEndpointInvoker implements EndpointInvoker {
    private final OkHttpClient httpClient;
    private final MediaType contentType;

    public HttpEndpointInvoker(OkHttpClient httpClient, String contentType) {
        this.httpClient = httpClient;
        this.contentType = MediaType.parse(contentType == null || contentType.isBlank() ? "text/csv" : contentType);
    }

    public static HttpEndpointInvoker create(Duration connectTimeout, Duration readTimeout, String contentType) {
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .build();
        return new HttpEndpointInvoker(client, contentType);
    }

    @Override
    public InvocationResult invoke(ServingEndpointHandle endpoint, String payload) throws IOException {
        if (endpoint.endpointUrl() == null || endpoint.endpointUrl().isBlank()) {
            throw new IOException("Endpoint " + endpoint.endpointName() + " has no URL");
        }
        Request request = new Request.Builder()
                .url(endpoint.endpointUrl())
                .post(RequestBody.create(payload == null ? "" : payload, contentType))
                .build();
        long start = System.nanoTime();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            double latencyMs = (System.nanoTime() - start) / 1_000_000.0;
            if (!response.isSuccessful()) {
                throw new IOException("Endpoint " + endpoint.endpointName() + " answered HTTP " + response.code());
            }
            return new InvocationResult(text.trim(), latencyMs);
        }
    }
}
