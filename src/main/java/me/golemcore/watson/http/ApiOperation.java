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

import lombok.Getter;
import me.golemcore.watson.error.WatsonErrorKind;
import okhttp3.HttpUrl;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Descriptor of one remote call: verb, path template, parameters, payload,
 * how to decode a success and which error statuses the operation documents.
 *
 * <p>
 * Path templates use {@code {name}} placeholders, each standing for exactly
 * one path segment, e.g. {@code v1/customizations/{customization_id}/words/{word}}.
 * Statuses outside the documented set are reported as
 * {@link WatsonErrorKind#UNMAPPED_RESPONSE}.
 */
@Getter
public final class ApiOperation<T> {

    private final String name;
    private final HttpMethod method;
    private final String pathTemplate;
    private final Map<String, String> pathParams;
    private final Map<String, String> queryParams;
    private final RequestPayload payload;
    private final ResponseDecoder<T> decoder;
    private final Set<Integer> successStatuses;
    private final Set<WatsonErrorKind> documentedErrors;
    private final String resourceId;
    private final String accept;

    private ApiOperation(Builder<T> builder) {
        this.name = builder.name != null ? builder.name : builder.method + " " + builder.pathTemplate;
        this.method = builder.method;
        this.pathTemplate = builder.pathTemplate;
        this.pathParams = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pathParams));
        this.queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(builder.queryParams));
        this.payload = builder.payload;
        this.decoder = builder.decoder;
        this.successStatuses = builder.successStatuses != null ? builder.successStatuses : Set.of(200);
        this.documentedErrors = Collections.unmodifiableSet(builder.documentedErrors);
        this.resourceId = builder.resourceId;
        this.accept = builder.accept;
    }

    public static <T> Builder<T> builder(HttpMethod method, String pathTemplate, ResponseDecoder<T> decoder) {
        return new Builder<>(method, pathTemplate, decoder);
    }

    public boolean isSuccess(int statusCode) {
        return successStatuses.contains(statusCode);
    }

    /**
     * Kind reported for a non-success status: its mapped kind when the
     * operation documents it, {@link WatsonErrorKind#UNMAPPED_RESPONSE}
     * otherwise.
     */
    public WatsonErrorKind classify(int statusCode) {
        WatsonErrorKind kind = WatsonErrorKind.forStatus(statusCode);
        return documentedErrors.contains(kind) ? kind : WatsonErrorKind.UNMAPPED_RESPONSE;
    }

    HttpUrl resolveUrl(ServiceEndpoint endpoint) {
        HttpUrl.Builder url = endpoint.newUrlBuilder();
        for (String segment : pathTemplate.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            if (segment.startsWith("{") && segment.endsWith("}")) {
                String param = segment.substring(1, segment.length() - 1);
                String value = pathParams.get(param);
                if (value == null || value.isEmpty()) {
                    throw new IllegalArgumentException(name + ": missing path parameter '" + param + "'");
                }
                if (isDotSegment(value)) {
                    throw new IllegalArgumentException(name + ": path parameter '" + param
                            + "' must not be a dot segment: " + value);
                }
                url.addPathSegment(value);
            } else {
                url.addPathSegment(segment);
            }
        }
        queryParams.forEach(url::addQueryParameter);
        return url.build();
    }

    // OkHttp resolves "." and ".." (also percent-encoded) instead of encoding them
    private static boolean isDotSegment(String value) {
        String normalized = value.toLowerCase(Locale.ROOT).replace("%2e", ".");
        return ".".equals(normalized) || "..".equals(normalized);
    }

    public static final class Builder<T> {

        private final HttpMethod method;
        private final String pathTemplate;
        private final ResponseDecoder<T> decoder;
        private final Map<String, String> pathParams = new LinkedHashMap<>();
        private final Map<String, String> queryParams = new LinkedHashMap<>();
        private final Set<WatsonErrorKind> documentedErrors = EnumSet.noneOf(WatsonErrorKind.class);
        private String name;
        private RequestPayload payload;
        private Set<Integer> successStatuses;
        private String resourceId;
        private String accept = "application/json";

        private Builder(HttpMethod method, String pathTemplate, ResponseDecoder<T> decoder) {
            if (method == null || pathTemplate == null || decoder == null) {
                throw new IllegalArgumentException("method, pathTemplate and decoder are required");
            }
            this.method = method;
            this.pathTemplate = pathTemplate;
            this.decoder = decoder;
        }

        public Builder<T> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<T> pathParam(String param, String value) {
            pathParams.put(param, value);
            return this;
        }

        /**
         * Adds a query parameter; {@code null} values are skipped.
         */
        public Builder<T> queryParam(String param, String value) {
            if (value != null) {
                queryParams.put(param, value);
            }
            return this;
        }

        public Builder<T> payload(RequestPayload payload) {
            this.payload = payload;
            return this;
        }

        public Builder<T> successStatus(Integer... statuses) {
            this.successStatuses = Set.copyOf(Arrays.asList(statuses));
            return this;
        }

        public Builder<T> errors(WatsonErrorKind... kinds) {
            documentedErrors.addAll(Arrays.asList(kinds));
            return this;
        }

        public Builder<T> resourceId(String resourceId) {
            this.resourceId = resourceId;
            return this;
        }

        /**
         * Value of the {@code Accept} header; {@code null} omits the header.
         */
        public Builder<T> accept(String accept) {
            this.accept = accept;
            return this;
        }

        public ApiOperation<T> build() {
            if (payload != null && !method.permitsBody()) {
                throw new IllegalArgumentException(method + " " + pathTemplate + " cannot carry a body");
            }
            return new ApiOperation<>(this);
        }
    }
}
