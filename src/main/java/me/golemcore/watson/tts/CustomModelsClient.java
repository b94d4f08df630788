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

import com.fasterxml.jackson.annotation.JsonInclude;
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
import me.golemcore.watson.tts.model.CustomModel;
import me.golemcore.watson.tts.model.Language;
import me.golemcore.watson.tts.model.Word;

import java.util.List;

import static me.golemcore.watson.error.WatsonErrorKind.BAD_REQUEST;
import static me.golemcore.watson.error.WatsonErrorKind.INTERNAL_SERVER_ERROR;
import static me.golemcore.watson.error.WatsonErrorKind.NOT_MODIFIED;
import static me.golemcore.watson.error.WatsonErrorKind.SERVICE_UNAVAILABLE;
import static me.golemcore.watson.error.WatsonErrorKind.UNAUTHORIZED;

/**
 * Custom models: named collections of word translations and prompts that
 * adjust synthesis for one language.
 */
@Slf4j
@RequiredArgsConstructor
public class CustomModelsClient {

    private static final String MODELS_PATH = "v1/customizations";
    private static final String MODEL_PATH = "v1/customizations/{customization_id}";
    private static final TypeReference<List<CustomModel>> MODEL_LIST = new TypeReference<>() {
    };
    private static final WatsonErrorKind[] MODEL_ERRORS = {
            BAD_REQUEST, UNAUTHORIZED, INTERNAL_SERVER_ERROR, SERVICE_UNAVAILABLE };

    private final WatsonHttpExecutor executor;

    /**
     * Creates an empty custom model.
     *
     * @param name
     *            model name, required
     * @param language
     *            language of the model; {@code null} for
     *            {@link Language#DEFAULT}
     * @param description
     *            optional description
     */
    public CustomModel createCustomModel(String name, Language language, String description) {
        return createCustomModel(name, language, description, RequestOptions.defaults());
    }

    public CustomModel createCustomModel(String name, Language language, String description,
            RequestOptions options) {
        Arguments.requireNonBlank(name, "name");
        Language effectiveLanguage = language != null ? language : Language.DEFAULT;
        ApiOperation<CustomModel> operation = ApiOperation
                .builder(HttpMethod.POST, MODELS_PATH, ResponseDecoder.json(CustomModel.class))
                .name("createCustomModel")
                .payload(RequestPayload.json(new CreateModelRequest(name, effectiveLanguage.getId(), description)))
                .successStatus(200, 201)
                .errors(BAD_REQUEST, INTERNAL_SERVER_ERROR, SERVICE_UNAVAILABLE)
                .build();
        CustomModel model = executor.execute(operation, options);
        log.info("[TTS] Custom model created: id={}, language={}", model.customizationId(),
                effectiveLanguage.getId());
        return model;
    }

    /**
     * Lists the caller's custom models.
     *
     * @param language
     *            only models of this language; {@code null} for all
     */
    public List<CustomModel> listCustomModels(Language language) {
        return listCustomModels(language, RequestOptions.defaults());
    }

    public List<CustomModel> listCustomModels(Language language, RequestOptions options) {
        ApiOperation<List<CustomModel>> operation = ApiOperation
                .builder(HttpMethod.GET, MODELS_PATH, ResponseDecoder.jsonField("customizations", MODEL_LIST))
                .name("listCustomModels")
                .queryParam("language", language != null ? language.getId() : null)
                .errors(BAD_REQUEST, INTERNAL_SERVER_ERROR, SERVICE_UNAVAILABLE)
                .build();
        return executor.execute(operation, options);
    }

    /**
     * Updates name, description or words of a custom model. {@code null}
     * arguments leave the corresponding property unchanged.
     */
    public void updateCustomModel(String customizationId, String name, String description, List<Word> words) {
        updateCustomModel(customizationId, name, description, words, RequestOptions.defaults());
    }

    public void updateCustomModel(String customizationId, String name, String description, List<Word> words,
            RequestOptions options) {
        Arguments.requireNonBlank(customizationId, "customizationId");
        ApiOperation<Void> operation = ApiOperation
                .builder(HttpMethod.POST, MODEL_PATH, ResponseDecoder.discarding())
                .name("updateCustomModel")
                .pathParam("customization_id", customizationId)
                .payload(RequestPayload.json(new UpdateModelRequest(name, description, words)))
                .resourceId(customizationId)
                .errors(MODEL_ERRORS)
                .build();
        executor.execute(operation, options);
    }

    public CustomModel getCustomModel(String customizationId) {
        return getCustomModel(customizationId, RequestOptions.defaults());
    }

    public CustomModel getCustomModel(String customizationId, RequestOptions options) {
        Arguments.requireNonBlank(customizationId, "customizationId");
        ApiOperation<CustomModel> operation = ApiOperation
                .builder(HttpMethod.GET, MODEL_PATH, ResponseDecoder.json(CustomModel.class))
                .name("getCustomModel")
                .pathParam("customization_id", customizationId)
                .resourceId(customizationId)
                .errors(NOT_MODIFIED)
                .errors(MODEL_ERRORS)
                .build();
        return executor.execute(operation, options);
    }

    public void deleteCustomModel(String customizationId) {
        deleteCustomModel(customizationId, RequestOptions.defaults());
    }

    public void deleteCustomModel(String customizationId, RequestOptions options) {
        Arguments.requireNonBlank(customizationId, "customizationId");
        ApiOperation<Void> operation = ApiOperation
                .builder(HttpMethod.DELETE, MODEL_PATH, ResponseDecoder.discarding())
                .name("deleteCustomModel")
                .pathParam("customization_id", customizationId)
                .successStatus(204)
                .resourceId(customizationId)
                .errors(MODEL_ERRORS)
                .build();
        executor.execute(operation, options);
        log.info("[TTS] Custom model deleted: id={}", customizationId);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CreateModelRequest(String name, String language, String description) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record UpdateModelRequest(String name, String description, List<Word> words) {
    }
}
