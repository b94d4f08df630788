package me.golemcore.watson.tts.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The {@code metadata} part of an add-prompt upload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PromptMetadata(
        @JsonProperty("prompt_text") String promptText,
        @JsonProperty("speaker_id") String speakerId) {

    public PromptMetadata {
        if (promptText == null || promptText.isBlank()) {
            throw new IllegalArgumentException("prompt_text is required");
        }
    }

    public static PromptMetadata of(String promptText) {
        return new PromptMetadata(promptText, null);
    }
}
