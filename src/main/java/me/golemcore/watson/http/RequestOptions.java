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

import java.time.Duration;

/**
 * Per-call transport options.
 *
 * @param timeout
 *            total call timeout for this call, or {@code null} to use the
 *            shared client's timeouts
 */
public record RequestOptions(Duration timeout) {

    private static final RequestOptions DEFAULTS = new RequestOptions(null);

    public RequestOptions {
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
    }

    public static RequestOptions defaults() {
        return DEFAULTS;
    }

    public static RequestOptions withTimeout(Duration timeout) {
        return new RequestOptions(timeout);
    }
}
