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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Turns the body of a successful response into the operation's result type.
 *
 * <p>
 * Any {@link IOException} thrown here is reported as an undecodable response,
 * never as a transport failure.
 */
@FunctionalInterface
public interface ResponseDecoder<T> {

    T decode(byte[] body, ObjectMapper objectMapper) throws IOException;

    static <T> ResponseDecoder<T> json(Class<T> type) {
        return (body, mapper) -> mapper.readValue(body, type);
    }

    static <T> ResponseDecoder<T> json(TypeReference<T> type) {
        return (body, mapper) -> mapper.readValue(body, type);
    }

    /**
     * Decodes a single field of an envelope object, e.g. {@code voices} in
     * {@code {"voices":[...]}}. A missing field is a decode failure.
     */
    static <T> ResponseDecoder<T> jsonField(String field, TypeReference<T> type) {
        return (body, mapper) -> {
            JsonNode root = mapper.readTree(body);
            JsonNode node = root != null ? root.get(field) : null;
            if (node == null || node.isNull()) {
                throw new JsonMappingException(null, "Missing field '" + field + "' in response");
            }
            return mapper.readerFor(type).readValue(node);
        };
    }

    static ResponseDecoder<byte[]> bytes() {
        return (body, mapper) -> body;
    }

    static ResponseDecoder<Void> discarding() {
        return (body, mapper) -> null;
    }
}
