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
 * Base type of every failure raised by the Watson clients.
 *
 * <p>
 * All failures are unchecked and reach the immediate caller unchanged: the
 * clients never retry, fall back or swallow an error.
 */
public abstract class WatsonException extends RuntimeException {

    private final WatsonErrorKind kind;

    protected WatsonException(WatsonErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected WatsonException(WatsonErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public WatsonErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
