package me.golemcore.watson.http;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.watson.auth.BearerTokenSource;
import me.golemcore.watson.error.WatsonApiException;
import me.golemcore.watson.error.WatsonConnectionException;
import me.golemcore.watson.error.WatsonErrorKind;
import me.golemcore.watson.error.WatsonException;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single request routine behind every Watson resource operation.
 *
 * <p>
 * Builds the URL from the {@link ApiOperation}, attaches the bearer token,
 * dispatches on the shared {@link OkHttpClient} and turns the response into
 * either the decoded value or a {@link WatsonException}. One round trip per
 * call; nothing is retried.
 */
@Slf4j
public class WatsonHttpExecutor {

    private static final int MAX_SERVICE_MESSAGE_LENGTH = 500;

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final ServiceEndpoint endpoint;
    private final BearerTokenSource tokenSource;

    public WatsonHttpExecutor(OkHttpClient okHttpClient, ObjectMapper objectMapper, ServiceEndpoint endpoint,
            BearerTokenSource tokenSource) {
        if (okHttpClient == null || objectMapper == null || endpoint == null || tokenSource == null) {
            throw new IllegalArgumentException("okHttpClient, objectMapper, endpoint and tokenSource are required");
        }
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
        this.tokenSource = tokenSource;
    }

    public ServiceEndpoint getEndpoint() {
        return endpoint;
    }

    public <T> T execute(ApiOperation<T> operation) {
        return execute(operation, RequestOptions.defaults());
    }

    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    public <T> T execute(ApiOperation<T> operation, RequestOptions options) {
        Request request = buildRequest(operation);
        long startTime = System.currentTimeMillis();
        try (Response response = newCall(request, options).execute()) {
            return handleResponse(operation, response, startTime);
        } catch (IOException e) {
            log.debug("[WatsonHttp] {} transport failure: {}", operation.getName(), e.getMessage());
            throw new WatsonConnectionException(operation.getName(), e);
        }
    }

    public <T> CompletableFuture<T> executeAsync(ApiOperation<T> operation) {
        return executeAsync(operation, RequestOptions.defaults());
    }

    /**
     * Dispatches the call on OkHttp's dispatcher. Cancelling the returned
     * future cancels the underlying call.
     */
    public <T> CompletableFuture<T> executeAsync(ApiOperation<T> operation, RequestOptions options) {
        Request request;
        try {
            request = buildRequest(operation);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        Call call = newCall(request, options);
        CompletableFuture<T> future = new CompletableFuture<>();
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                log.debug("[WatsonHttp] {} cancelled", operation.getName());
                call.cancel();
            }
        });

        long startTime = System.currentTimeMillis();
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException e) {
                log.debug("[WatsonHttp] {} transport failure: {}", operation.getName(), e.getMessage());
                future.completeExceptionally(new WatsonConnectionException(operation.getName(), e));
            }

            @Override
            public void onResponse(Call completedCall, Response response) {
                try (response) {
                    future.complete(handleResponse(operation, response, startTime));
                } catch (IOException e) {
                    future.completeExceptionally(new WatsonConnectionException(operation.getName(), e));
                } catch (RuntimeException e) {
                    // a failing decoder must not leave the future pending
                    future.completeExceptionally(e);
                }
            }
        });
        return future;
    }

    private Request buildRequest(ApiOperation<?> operation) {
        HttpUrl url = operation.resolveUrl(endpoint);
        RequestBody body = null;
        if (operation.getPayload() != null) {
            try {
                body = operation.getPayload().toRequestBody(objectMapper);
            } catch (IOException e) {
                throw new IllegalArgumentException(operation.getName() + ": request body could not be serialized", e);
            }
        } else if (operation.getMethod().permitsBody()) {
            body = RequestBody.create(new byte[0], null);
        }

        log.debug("[WatsonHttp] {} {}", operation.getMethod(), url.redact());

        Request.Builder request = new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + tokenSource.bearerToken())
                .method(operation.getMethod().name(), body);
        if (operation.getAccept() != null) {
            request.header("Accept", operation.getAccept());
        }
        return request.build();
    }

    private Call newCall(Request request, RequestOptions options) {
        if (options != null && options.timeout() != null) {
            OkHttpClient client = okHttpClient.newBuilder()
                    .callTimeout(options.timeout().toMillis(), TimeUnit.MILLISECONDS)
                    .build();
            return client.newCall(request);
        }
        return okHttpClient.newCall(request);
    }

    private <T> T handleResponse(ApiOperation<T> operation, Response response, long startTime) throws IOException {
        int status = response.code();
        byte[] body = readBody(response);
        long elapsed = System.currentTimeMillis() - startTime;

        if (operation.isSuccess(status)) {
            log.debug("[WatsonHttp] {} -> {} ({} bytes, {}ms)", operation.getName(), status, body.length, elapsed);
            try {
                return operation.getDecoder().decode(body, objectMapper);
            } catch (IOException e) {
                log.debug("[WatsonHttp] {} returned an undecodable body: {}", operation.getName(), e.getMessage());
                throw new WatsonApiException(operation.getName(), status, e);
            }
        }

        WatsonErrorKind kind = operation.classify(status);
        String serviceMessage = extractServiceMessage(body);
        log.debug("[WatsonHttp] {} -> {} {} ({}ms): {}", operation.getName(), status, kind, elapsed,
                serviceMessage);
        throw new WatsonApiException(kind, operation.getName(), status, operation.getResourceId(), serviceMessage);
    }

    @SuppressWarnings("PMD.CloseResource") // closed together with the Response
    private byte[] readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.bytes() : new byte[0];
    }

    private String extractServiceMessage(byte[] body) {
        if (body.length == 0) {
            return null;
        }
        try {
            ServiceErrorBody errorBody = objectMapper.readValue(body, ServiceErrorBody.class);
            if (errorBody != null && errorBody.message() != null) {
                return errorBody.message();
            }
        } catch (IOException e) {
            log.debug("[WatsonHttp] Could not parse error response: {}", e.getMessage());
        }
        String raw = new String(body, StandardCharsets.UTF_8).strip();
        if (raw.isEmpty()) {
            return null;
        }
        return raw.length() > MAX_SERVICE_MESSAGE_LENGTH ? raw.substring(0, MAX_SERVICE_MESSAGE_LENGTH) + "..." : raw;
    }
}
