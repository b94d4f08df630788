package me.golemcore.watson.auth;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Exchanges an IBM Cloud API key for an IAM access token.
 *
 * <p>
 * The authenticator remembers the last token it obtained and, as a
 * {@link BearerTokenSource}, hands it to the resource clients. With
 * auto-refresh enabled a new exchange runs when there is no token yet or the
 * current one expires within the refresh skew. Exchanges are serialized, so
 * concurrent callers trigger at most one.
 */
@Slf4j
public class IamAuthenticator implements BearerTokenSource {

    public static final String DEFAULT_URL = "https://iam.cloud.ibm.com/identity/token";
    public static final Duration DEFAULT_REFRESH_SKEW = Duration.ofSeconds(60);

    private static final String GRANT_TYPE = "urn:ibm:params:oauth:grant-type:apikey";
    private static final MediaType FORM = MediaType.get("application/x-www-form-urlencoded");

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final HttpUrl iamUrl;
    private final boolean autoRefresh;
    private final Duration refreshSkew;
    private final Clock clock;

    private volatile AccessToken accessToken;

    public IamAuthenticator(OkHttpClient okHttpClient, ObjectMapper objectMapper, String apiKey) {
        this(okHttpClient, objectMapper, apiKey, DEFAULT_URL, true, DEFAULT_REFRESH_SKEW, Clock.systemUTC());
    }

    public IamAuthenticator(OkHttpClient okHttpClient, ObjectMapper objectMapper, String apiKey, String iamUrl,
            boolean autoRefresh, Duration refreshSkew, Clock clock) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("IAM API key is required");
        }
        HttpUrl parsedUrl = iamUrl != null ? HttpUrl.parse(iamUrl) : null;
        if (parsedUrl == null || !parsedUrl.isHttps()) {
            throw new IllegalArgumentException("IAM URL must be a valid https URL: " + iamUrl);
        }
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.iamUrl = parsedUrl;
        this.autoRefresh = autoRefresh;
        this.refreshSkew = refreshSkew != null ? refreshSkew : DEFAULT_REFRESH_SKEW;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Exchanges the configured API key and keeps the resulting token.
     */
    public synchronized AccessToken authenticate() {
        AccessToken token = exchange(apiKey);
        this.accessToken = token;
        return token;
    }

    /**
     * Exchanges the given API key for a token. Does not touch the kept token.
     */
    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    public AccessToken exchange(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("IAM API key is required");
        }

        String form = "grant_type=" + URLEncoder.encode(GRANT_TYPE, StandardCharsets.UTF_8)
                + "&apikey=" + URLEncoder.encode(key, StandardCharsets.UTF_8);
        Request request = new Request.Builder()
                .url(iamUrl)
                .header("Accept", "application/json")
                .post(RequestBody.create(form.getBytes(StandardCharsets.UTF_8), FORM))
                .build();

        log.debug("[IAM] Requesting token from {}", iamUrl.redact());
        long startTime = System.currentTimeMillis();
        try (Response response = okHttpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String responseBody = body != null ? body.string() : "";
            long elapsed = System.currentTimeMillis() - startTime;

            if (response.code() != 200) {
                AuthenticationFailure failure = AuthenticationFailure.forStatus(response.code());
                log.debug("[IAM] Token request failed: {} {} ({}ms)", response.code(), failure, elapsed);
                throw new AuthenticationException(failure, response.code(), extractErrorMessage(responseBody));
            }

            AccessToken token = parseToken(responseBody);
            log.info("[IAM] Token obtained: type={}, expiresIn={}s ({}ms)",
                    token.tokenType(), token.expiresIn(), elapsed);
            return token;
        } catch (IOException e) {
            log.debug("[IAM] Token request transport failure: {}", e.getMessage());
            throw new AuthenticationException(AuthenticationFailure.CONNECTION_ERROR, e.getMessage(), e);
        }
    }

    public Optional<AccessToken> getAccessToken() {
        return Optional.ofNullable(accessToken);
    }

    public boolean isAutoRefresh() {
        return autoRefresh;
    }

    @Override
    public String bearerToken() {
        AccessToken current = accessToken;
        if (current != null && (!autoRefresh || !current.isExpired(clock, refreshSkew))) {
            return current.accessToken();
        }
        synchronized (this) {
            current = accessToken;
            if (current == null || autoRefresh && current.isExpired(clock, refreshSkew)) {
                if (current != null) {
                    log.debug("[IAM] Token expires at {}, refreshing", current.getExpiresAt());
                }
                current = authenticate();
            }
            return current.accessToken();
        }
    }

    private AccessToken parseToken(String responseBody) {
        try {
            AccessToken token = objectMapper.readValue(responseBody, AccessToken.class);
            if (token == null || token.accessToken() == null || token.accessToken().isBlank()) {
                throw new AuthenticationException(AuthenticationFailure.INVALID_RESPONSE, 200,
                        "Response carries no access_token");
            }
            if (token.expiration() <= 0) {
                throw new AuthenticationException(AuthenticationFailure.INVALID_RESPONSE, 200,
                        "Response carries no expiration");
            }
            return token;
        } catch (IOException e) {
            throw new AuthenticationException(AuthenticationFailure.INVALID_RESPONSE, e.getMessage(), e);
        }
    }

    private String extractErrorMessage(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return null;
        }
        try {
            IamErrorResponse error = objectMapper.readValue(responseBody, IamErrorResponse.class);
            if (error.errorMessage() != null) {
                return error.errorCode() != null ? error.errorCode() + ": " + error.errorMessage()
                        : error.errorMessage();
            }
        } catch (IOException e) {
            log.debug("[IAM] Could not parse error response: {}", e.getMessage());
        }
        return null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record IamErrorResponse(String errorCode, String errorMessage) {
    }
}
