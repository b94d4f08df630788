package me.golemcore.watson.stt;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.watson.auth.BearerTokenSource;
import me.golemcore.watson.http.ApiOperation;
import me.golemcore.watson.http.HttpMethod;
import me.golemcore.watson.http.RequestOptions;
import me.golemcore.watson.http.ResponseDecoder;
import me.golemcore.watson.http.ServiceEndpoint;
import me.golemcore.watson.http.WatsonHttpExecutor;
import me.golemcore.watson.stt.model.SpeechModel;
import me.golemcore.watson.stt.model.SpeechModelId;
import okhttp3.OkHttpClient;

import java.util.List;

import static me.golemcore.watson.error.WatsonErrorKind.INTERNAL_SERVER_ERROR;
import static me.golemcore.watson.error.WatsonErrorKind.NOT_ACCEPTABLE;
import static me.golemcore.watson.error.WatsonErrorKind.NOT_FOUND;
import static me.golemcore.watson.error.WatsonErrorKind.SERVICE_UNAVAILABLE;
import static me.golemcore.watson.error.WatsonErrorKind.UNSUPPORTED_MEDIA_TYPE;

/**
 * Entry point to one Speech to Text service instance. Covers the model
 * catalogue.
 */
@Slf4j
public class SpeechToText {

    private static final TypeReference<List<SpeechModel>> MODEL_LIST = new TypeReference<>() {
    };

    private final WatsonHttpExecutor executor;

    public SpeechToText(OkHttpClient okHttpClient, ObjectMapper objectMapper, ServiceEndpoint endpoint,
            BearerTokenSource tokenSource) {
        this(new WatsonHttpExecutor(okHttpClient, objectMapper, endpoint, tokenSource));
    }

    public SpeechToText(WatsonHttpExecutor executor) {
        this.executor = executor;
        log.debug("[STT] Client created for {}", executor.getEndpoint());
    }

    public ServiceEndpoint getEndpoint() {
        return executor.getEndpoint();
    }

    public List<SpeechModel> listModels() {
        return listModels(RequestOptions.defaults());
    }

    public List<SpeechModel> listModels(RequestOptions options) {
        ApiOperation<List<SpeechModel>> operation = ApiOperation
                .builder(HttpMethod.GET, "v1/models", ResponseDecoder.jsonField("models", MODEL_LIST))
                .name("listModels")
                .errors(NOT_ACCEPTABLE, UNSUPPORTED_MEDIA_TYPE, INTERNAL_SERVER_ERROR, SERVICE_UNAVAILABLE)
                .build();
        List<SpeechModel> models = executor.execute(operation, options);
        log.debug("[STT] {} models available", models.size());
        return models;
    }

    public SpeechModel getModel(SpeechModelId modelId) {
        return getModel(modelId, RequestOptions.defaults());
    }

    public SpeechModel getModel(SpeechModelId modelId, RequestOptions options) {
        if (modelId == null) {
            throw new IllegalArgumentException("modelId is required");
        }
        ApiOperation<SpeechModel> operation = ApiOperation
                .builder(HttpMethod.GET, "v1/models/{model_id}", ResponseDecoder.json(SpeechModel.class))
                .name("getModel")
                .pathParam("model_id", modelId.getId())
                .resourceId(modelId.getId())
                .errors(NOT_FOUND, NOT_ACCEPTABLE, UNSUPPORTED_MEDIA_TYPE, INTERNAL_SERVER_ERROR,
                        SERVICE_UNAVAILABLE)
                .build();
        return executor.execute(operation, options);
    }
}
