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
import me.golemcore.watson.http.ApiOperation;
import me.golemcore.watson.http.HttpMethod;
import me.golemcore.watson.http.RequestOptions;
import me.golemcore.watson.http.ResponseDecoder;
import me.golemcore.watson.http.WatsonHttpExecutor;
import me.golemcore.watson.tts.model.Voice;
import me.golemcore.watson.tts.model.WatsonVoice;

import java.util.List;

import static me.golemcore.watson.error.WatsonErrorKind.BAD_REQUEST;
import static me.golemcore.watson.error.WatsonErrorKind.INTERNAL_SERVER_ERROR;
import static me.golemcore.watson.error.WatsonErrorKind.NOT_ACCEPTABLE;
import static me.golemcore.watson.error.WatsonErrorKind.NOT_MODIFIED;
import static me.golemcore.watson.error.WatsonErrorKind.SERVICE_UNAVAILABLE;
import static me.golemcore.watson.error.WatsonErrorKind.UNAUTHORIZED;
import static me.golemcore.watson.error.WatsonErrorKind.UNSUPPORTED_MEDIA_TYPE;

/**
 * Voice catalogue.
 */
@RequiredArgsConstructor
public class VoicesClient {

    private static final TypeReference<List<Voice>> VOICE_LIST = new TypeReference<>() {
    };

    private final WatsonHttpExecutor executor;

    /**
     * Lists all voices available for synthesis.
     */
    public List<Voice> listVoices() {
        return listVoices(RequestOptions.defaults());
    }

    public List<Voice> listVoices(RequestOptions options) {
        ApiOperation<List<Voice>> operation = ApiOperation
                .builder(HttpMethod.GET, "v1/voices", ResponseDecoder.jsonField("voices", VOICE_LIST))
                .name("listVoices")
                .errors(NOT_ACCEPTABLE, UNSUPPORTED_MEDIA_TYPE, INTERNAL_SERVER_ERROR, SERVICE_UNAVAILABLE)
                .build();
        return executor.execute(operation, options);
    }

    /**
     * Gets one voice.
     *
     * @param voice
     *            the voice
     * @param customizationId
     *            optional custom model whose details are returned in
     *            {@link Voice#customization()}; must belong to the caller and
     *            match the voice's language
     */
    public Voice getVoice(WatsonVoice voice, String customizationId) {
        return getVoice(voice, customizationId, RequestOptions.defaults());
    }

    public Voice getVoice(WatsonVoice voice, String customizationId, RequestOptions options) {
        if (voice == null) {
            throw new IllegalArgumentException("voice is required");
        }
        ApiOperation<Voice> operation = ApiOperation
                .builder(HttpMethod.GET, "v1/voices/{voice}", ResponseDecoder.json(Voice.class))
                .name("getVoice")
                .pathParam("voice", voice.getId())
                .queryParam("customization_id", customizationId)
                .resourceId(customizationId != null ? customizationId : voice.getId())
                .errors(NOT_MODIFIED, BAD_REQUEST, UNAUTHORIZED, NOT_ACCEPTABLE, INTERNAL_SERVER_ERROR,
                        SERVICE_UNAVAILABLE)
                .build();
        return executor.execute(operation, options);
    }
}
