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

import java.io.IOException;

/**
 * Transport-level failure: DNS, TLS, refused connection, timeout or a body
 * that broke off mid-read. No HTTP status is available.
 */
public class WatsonConnectionException extends WatsonException {

    public WatsonConnectionException(String operation, IOException cause) {
        super(WatsonErrorKind.CONNECTION_ERROR, operation + " failed: " + describe(cause), cause);
    }

    private static String describe(IOException cause) {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
