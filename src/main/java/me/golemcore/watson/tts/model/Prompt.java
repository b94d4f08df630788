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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A custom prompt of a custom model.
 *
 * @param prompt
 *            text of the prompt as given at creation
 * @param promptId
 *            identifier the prompt is addressed by
 * @param status
 *            {@code processing}, {@code available} or {@code failed}
 * @param error
 *            reason processing failed, if it did
 * @param speakerId
 *            speaker model the prompt was recorded by, if any
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Prompt(
        String prompt,
        @JsonProperty("prompt_id") String promptId,
        String status,
        String error,
        @JsonProperty("speaker_id") String speakerId) {
}
