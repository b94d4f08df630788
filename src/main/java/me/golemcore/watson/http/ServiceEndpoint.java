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

import okhttp3.HttpUrl;

/**
 * Base URL of one service instance, e.g.
 * {@code https://api.eu-de.text-to-speech.watson.cloud.ibm.com/instances/<guid>}.
 * Resource paths are appended to whatever path the base URL already has.
 */
public record ServiceEndpoint(HttpUrl baseUrl) {

    public ServiceEndpoint {
        if (baseUrl == null) {
            throw new IllegalArgumentException("Service URL is required");
        }
        if (!baseUrl.isHttps()) {
            throw new IllegalArgumentException("Service URL must use https: " + baseUrl.redact());
        }
    }

    public static ServiceEndpoint of(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Service URL is required");
        }
        HttpUrl parsed = HttpUrl.parse(url.trim());
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid service URL: " + url);
        }
        return new ServiceEndpoint(parsed);
    }

    HttpUrl.Builder newUrlBuilder() {
        return baseUrl.newBuilder();
    }

    @Override
    public String toString() {
        return baseUrl.redact();
    }
}
