package me.golemcore.watson.tts;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.watson.error.WatsonErrorKind;
import me.golemcore.watson.http.ApiOperation;
import me.golemcore.watson.http.HttpMethod;
import me.golemcore.watson.http.RequestOptions;
import me.golemcore.watson.http.RequestPayload;
import me.golemcore.watson.http.ResponseDecoder;
import me.golemcore.watson.http.WatsonHttpExecutor;
import me.golemcore.watson.tts.model.Prompt;
import me.golemcore.watson.tts.model.PromptMetadata;
import okhttp3.MultipartBody;
import okhttp3.RequestBody;

import java.nio.file.Path;
import java.util.List;

import static me.golemcore.watson.error.WatsonErrorKind.BAD_REQUEST;
import static me.golemcore.watson.error.WatsonErrorKind.INTERNAL_SERVER_ERROR;
import static me.golemcore.watson.error.WatsonErrorKind.SERVICE_UNAVAILABLE;
import static me.golemcore.watson.error.WatsonErrorKind.UNAUTHORIZED;

/**
 * Custom prompts: recorded WAV audio plus the text it speaks, stored in a
 * custom model.
 */
@Slf4j
@RequiredArgsConstructor
public class CustomPromptsClient {

    private static final String PROMPTS_PATH = "v1/customizations/{customization_id}/prompts";
    private static final String PROMPT_PATH = "v1/customizations/{customization_id}/prompts/{prompt_id}";
    private static final TypeReference<List<Prompt>> PROMPT_LIST = new TypeReference<>() {
    };
    private static final WatsonErrorKind[] PROMPT_ERRORS = {
            BAD_REQUEST, UNAUTHORIZED, INTERNAL_SERVER_ERROR, SERVICE_UNAVAILABLE };

    private final WatsonHttpExecutor executor;

    public List<Prompt> listCustomPrompts(String customizationId) {
        return listCustomPrompts(customizationId, RequestOptions.defaults());
    }

    public List<Prompt> listCustomPrompts(String customizationId, RequestOptions options) {
        Arguments.requireNonBlank(customizationId, "customizationId");
        ApiOperation<List<Prompt>> operation = ApiOperation
                .builder(HttpMethod.GET, PROMPTS_PATH, ResponseDecoder.jsonField("prompts", PROMPT_LIST))
                .name("listCustomPrompts")
                .pathParam("customization_id", customizationId)
                .resourceId(customizationId)
                .errors(PROMPT_ERRORS)
                .build();
        return executor.execute(operation, options);
    }

    /**
     * Uploads a prompt read from a WAV file. The file is read before the
     * request is sent.
     */
    public Prompt addCustomPrompt(String customizationId, String promptId, PromptMetadata metadata, Path file) {
        return addCustomPrompt(customizationId, promptId, metadata, file, RequestOptions.defaults());
    }

    public Prompt addCustomPrompt(String customizationId, String promptId, PromptMetadata metadata, Path file,
            RequestOptions options) {
        byte[] audio = Arguments.readFile(file);
        return addCustomPrompt(customizationId, promptId, metadata, audio, file.getFileName().toString(), options);
    }

    /**
     * Uploads a prompt from WAV bytes held in memory.
     */
    public Prompt addCustomPrompt(String customizationId, String promptId, PromptMetadata metadata, byte[] audio,
            String fileName, RequestOptions options) {
        Arguments.requireNonBlank(customizationId, "customizationId");
        Arguments.requireNonBlank(promptId, "promptId");
        if (metadata == null) {
            throw new IllegalArgumentException("metadata is required");
        }
        if (audio == null || audio.length == 0) {
            throw new IllegalArgumentException("audio must not be empty");
        }
        String partName = fileName != null && !fileName.isBlank() ? fileName : promptId + ".wav";

        RequestPayload payload = mapper -> new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("metadata", null,
                        RequestBody.create(mapper.writeValueAsBytes(metadata), RequestPayload.JSON))
                .addFormDataPart("file", partName, RequestBody.create(audio, RequestPayload.WAV))
                .build();

        ApiOperation<Prompt> operation = ApiOperation
                .builder(HttpMethod.POST, PROMPT_PATH, ResponseDecoder.json(Prompt.class))
                .name("addCustomPrompt")
                .pathParam("customization_id", customizationId)
                .pathParam("prompt_id", promptId)
                .payload(payload)
                .successStatus(201)
                .resourceId(customizationId)
                .errors(PROMPT_ERRORS)
                .build();
        Prompt prompt = executor.execute(operation, options);
        log.info("[TTS] Prompt uploaded: customization={}, prompt={}, {} bytes, status={}",
                customizationId, promptId, audio.length, prompt.status());
        return prompt;
    }

    public Prompt getCustomPrompt(String customizationId, String promptId) {
        return getCustomPrompt(customizationId, promptId, RequestOptions.defaults());
    }

    public Prompt getCustomPrompt(String customizationId, String promptId, RequestOptions options) {
        Arguments.requireNonBlank(customizationId, "customizationId");
        Arguments.requireNonBlank(promptId, "promptId");
        ApiOperation<Prompt> operation = ApiOperation
                .builder(HttpMethod.GET, PROMPT_PATH, ResponseDecoder.json(Prompt.class))
                .name("getCustomPrompt")
                .pathParam("customization_id", customizationId)
                .pathParam("prompt_id", promptId)
                .resourceId(customizationId)
                .errors(PROMPT_ERRORS)
                .build();
        return executor.execute(operation, options);
    }

    public void deleteCustomPrompt(String customizationId, String promptId) {
        deleteCustomPrompt(customizationId, promptId, RequestOptions.defaults());
    }

    public void deleteCustomPrompt(String customizationId, String promptId, RequestOptions options) {
        Arguments.requireNonBlank(customizationId, "customizationId");
        Arguments.requireNonBlank(promptId, "promptId");
        ApiOperation<Void> operation = ApiOperation
                .builder(HttpMethod.DELETE, PROMPT_PATH, ResponseDecoder.discarding())
                .name("deleteCustomPrompt")
                .pathParam("customization_id", customizationId)
                .pathParam("prompt_id", promptId)
                .successStatus(204)
                .resourceId(customizationId)
                .errors(PROMPT_ERRORS)
                .build();
        executor.execute(operation, options);
    }
}
