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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.RequestBody;

/**
 * Body of an outgoing request, rendered lazily so JSON serialization uses the
 * executor's {@link ObjectMapper}.
 */
@FunctionalInterface
public interface RequestPayload {

    MediaType JSON = MediaType.get("application/json; charset=utf-8");
    MediaType WAV = MediaType.get("audio/wav");

    RequestBody toRequestBody(ObjectMapper objectMapper) throws JsonProcessingException;

    static RequestPayload json(Object value) {
        return mapper -> RequestBody.create(mapper.writeValueAsBytes(value), JSON);
    }

    static RequestPayload binary(byte[] content, MediaType mediaType) {
        return mapper -> RequestBody.create(content, mediaType);
    }
}
