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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Token issued by IBM Cloud IAM in exchange for an API key.
 *
 * @param accessToken
 *            bearer token for the resource services
 * @param refreshToken
 *            refresh token issued alongside the access token
 * @param tokenType
 *            usually {@code Bearer}
 * @param expiresIn
 *            lifetime in seconds
 * @param expiration
 *            expiry as epoch seconds
 * @param scope
 *            optional scope
 * @param delegatedRefreshToken
 *            optional delegated refresh token
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccessToken(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("expiration") long expiration,
        @JsonProperty("scope") String scope,
        @JsonProperty("delegated_refresh_token") String delegatedRefreshToken) {

    @JsonIgnore
    public Instant getExpiresAt() {
        return Instant.ofEpochSecond(expiration);
    }

    /**
     * @return {@code true} when the token is expired, or will be within
     *         {@code skew} of the clock's current instant
     */
    public boolean isExpired(Clock clock, Duration skew) {
        return !clock.instant().plus(skew).isBefore(getExpiresAt());
    }

    @Override
    public String toString() {
        return "AccessToken[tokenType=" + tokenType + ", expiresIn=" + expiresIn + ", expiration=" + expiration
                + ", scope=" + scope + "]";
    }
}
