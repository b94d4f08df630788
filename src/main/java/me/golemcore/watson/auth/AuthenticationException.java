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

import me.golemcore.watson.error.WatsonException;

/**
 * The API key could not be exchanged for a token.
 */
public class AuthenticationException extends WatsonException {

    private final AuthenticationFailure failure;
    private final int statusCode;

    public AuthenticationException(AuthenticationFailure failure, int statusCode, String detail) {
        super(failure.getErrorKind(), buildMessage(failure, statusCode, detail));
        this.failure = failure;
        this.statusCode = statusCode;
    }

    public AuthenticationException(AuthenticationFailure failure, String detail, Throwable cause) {
        super(failure.getErrorKind(), buildMessage(failure, 0, detail), cause);
        this.failure = failure;
        this.statusCode = 0;
    }

    public AuthenticationFailure getFailure() {
        return failure;
    }

    /**
     * @return HTTP status returned by IAM, or {@code 0} when none was received
     */
    public int getStatusCode() {
        return statusCode;
    }

    private static String buildMessage(AuthenticationFailure failure, int statusCode, String detail) {
        StringBuilder sb = new StringBuilder("IAM token exchange failed: ").append(failure.getDescription());
        if (statusCode > 0) {
            sb.append(" (HTTP ").append(statusCode).append(')');
        }
        if (detail != null && !detail.isBlank()) {
            sb.append(". ").append(detail);
        }
        return sb.toString();
    }
}
