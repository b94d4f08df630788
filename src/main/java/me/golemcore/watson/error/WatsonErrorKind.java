package me.golemcore.watson.error;

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

/**
 * Classification of every failure a Watson call can surface.
 *
 * <p>
 * HTTP-backed kinds carry the status code they are mapped from. Kinds with a
 * status of {@code 0} describe failures that never produced a classifiable
 * HTTP response.
 */
public enum WatsonErrorKind {

    /**
     * The resource has not been modified since the time given by
     * {@code If-Modified-Since}. Not a failure; the caller keeps its copy.
     */
    NOT_MODIFIED(304, "The requested resource has not been modified"),

    /**
     * A required input parameter is null or a parameter or header value is
     * invalid or not supported.
     */
    BAD_REQUEST(400, "A required input parameter is null or a specified input parameter or header value is invalid"),

    /**
     * The identifier in the request is invalid for the requesting credentials.
     */
    UNAUTHORIZED(401, "The specified identifier is invalid for the requesting credentials"),

    FORBIDDEN(403, "The caller is not allowed to perform the requested action"),

    NOT_FOUND(404, "The requested resource does not exist"),

    /**
     * The request specified an incompatible content type or failed to specify a
     * required sampling rate.
     */
    NOT_ACCEPTABLE(406, "The request specified an incompatible content type"),

    UNSUPPORTED_MEDIA_TYPE(415, "The request specified an unacceptable media type"),

    INTERNAL_SERVER_ERROR(500, "The service experienced an internal error"),

    SERVICE_UNAVAILABLE(503, "The service is currently unavailable"),

    /**
     * The service answered with a status the operation does not document.
     */
    UNMAPPED_RESPONSE(0, "The service returned an unexpected status"),

    /**
     * The service answered with a success status but a body that could not be
     * decoded.
     */
    INVALID_RESPONSE(0, "The service returned a body that could not be decoded"),

    CONNECTION_ERROR(0, "There was an error establishing the connection"),

    FILE_READ_ERROR(0, "There was an error reading the upload file");

    private final int statusCode;
    private final String description;

    WatsonErrorKind(int statusCode, String description) {
        this.statusCode = statusCode;
        this.description = description;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Whether repeating the same request later may succeed. The client never
     * retries on its own.
     */
    public boolean isRetryable() {
        return this == CONNECTION_ERROR || this == INTERNAL_SERVER_ERROR || this == SERVICE_UNAVAILABLE;
    }

    /**
     * Maps an HTTP status to its kind, or {@link #UNMAPPED_RESPONSE} when no
     * kind is bound to it.
     */
    public static WatsonErrorKind forStatus(int statusCode) {
        for (WatsonErrorKind kind : values()) {
            if (kind.statusCode != 0 && kind.statusCode == statusCode) {
                return kind;
            }
        }
        return UNMAPPED_RESPONSE;
    }
}
