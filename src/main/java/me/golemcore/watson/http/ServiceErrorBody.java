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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error envelope returned by the Watson services, e.g.
 * {@code {"code":404,"error":"Model not found","code_description":"Not Found"}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ServiceErrorBody(
        Integer code,
        String error,
        @JsonProperty("code_description") String codeDescription) {

    String message() {
        if (error != null && !error.isBlank()) {
            return error;
        }
        return codeDescription;
    }
}
