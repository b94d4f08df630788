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

import me.golemcore.watson.error.WatsonErrorKind;

/**
 * Ways the API key exchange can fail.
 */
public enum AuthenticationFailure {

    PARAMETER_VALIDATION_FAILED("Parameter validation failed", WatsonErrorKind.BAD_REQUEST),
    INVALID_API_KEY("The provided API key is invalid", WatsonErrorKind.UNAUTHORIZED),
    NOT_ALLOWED("The API key is not allowed to perform this action", WatsonErrorKind.FORBIDDEN),
    SERVER_ERROR("IAM experienced an internal error", WatsonErrorKind.INTERNAL_SERVER_ERROR),
    UNMAPPED_RESPONSE("IAM returned an unexpected status", WatsonErrorKind.UNMAPPED_RESPONSE),
    CONNECTION_ERROR("There was an error establishing the connection", WatsonErrorKind.CONNECTION_ERROR),
    INVALID_RESPONSE("IAM returned a token that could not be decoded", WatsonErrorKind.INVALID_RESPONSE);

    private final String description;
    private final WatsonErrorKind errorKind;

    AuthenticationFailure(String description, WatsonErrorKind errorKind) {
        this.description = description;
        this.errorKind = errorKind;
    }

    public String getDescription() {
        return description;
    }

    public WatsonErrorKind getErrorKind() {
        return errorKind;
    }

    static AuthenticationFailure forStatus(int statusCode) {
        return switch (statusCode) {
        case 400 -> PARAMETER_VALIDATION_FAILED;
        case 401 -> INVALID_API_KEY;
        case 403 -> NOT_ALLOWED;
        case 500 -> SERVER_ERROR;
        default -> UNMAPPED_RESPONSE;
        };
    }
}
