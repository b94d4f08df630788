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

/**
 * Supplies the bearer token placed on every resource call.
 */
@FunctionalInterface
public interface BearerTokenSource {

    String bearerToken();

    /**
     * Fixed token, for callers that manage token lifetime themselves.
     */
    static BearerTokenSource of(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Bearer token is required");
        }
        return () -> token;
    }
}
