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
import me.golemcore.watson.http.ApiOperation;
import me.golemcore.watson.http.HttpMethod;
import me.golemcore.watson.http.RequestOptions;
import me.golemcore.watson.http.RequestPayload;
import me.golemcore.watson.http.ResponseDecoder;
import me.golemcore.watson.http.WatsonHttpExecutor;
import me.golemcore.watson.tts.model.Speaker;
import me.golemcore.watson.tts.model.SpeakerCustomModel;

import java.nio.file.Path;
import java.util.List;

import static me.golemcore.watson.error.WatsonErrorKind.BAD_REQUEST;
import static me.golemcore.watson.error.WatsonErrorKind.INTERNAL_SERVER_ERROR;
import static me.golemcore.watson.error.WatsonErrorKind.NOT_MODIFIED;
import static me.golemcore.watson.error.WatsonErrorKind.SERVICE_UNAVAILABLE;
import static me.golemcore.watson.error.WatsonErrorKind.UNAUTHORIZED;
import static me.golemcore.watson.error.WatsonErrorKind.UNSUPPORTED_MEDIA_TYPE;

/**
 * Speaker models, enrolled from a WAV sample of the speaker's voice.
 */
@Slf4j
@RequiredArgsConstructor
public class SpeakerModelsClient {

    private static final String SPEAKERS_PATH = "v1/speakers";
    private static final String SPEAKER_PATH = "v1/speakers/{speaker_id}";
    private static final TypeReference<List<Speaker>> SPEAKER_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<SpeakerCustomModel>> SPEAKER_MODEL_LIST = new TypeReference<>() {
    };
    private static final TypeReference<String> SPEAKER_ID = new TypeReference<>() {
    };

    private final WatsonHttpExecutor executor;

    public List<Speaker> listSpeakerModels() {
        return listSpeakerModels(RequestOptions.defaults());
    }

    public List<Speaker> listSpeakerModels(RequestOptions options) {
        ApiOperation<List<Speaker>> operation = ApiOperation
                .builder(HttpMethod.GET, SPEAKERS_PATH, ResponseDecoder.jsonField("speakers", SPEAKER_LIST))
                .name("listSpeakerModels")
                .errors(BAD_REQUEST, INTERNAL_SERVER_ERROR, SERVICE_UNAVAILABLE)
                .build();
        return executor.execute(operation, options);
    }

    /**
     * Enrolls a speaker from a WAV file.
     *
     * @return the new speaker id
     */
    public String createSpeakerModel(String speakerName, Path wavFile) {
        return createSpeakerModel(speakerName, wavFile, RequestOptions.defaults());
    }

    public String createSpeakerModel(String speakerName, Path wavFile, RequestOptions options) {
        Arguments.requireNonBlank(speakerName, "speakerName");
        return createSpeakerModel(speakerName, Arguments.readFile(wavFile), options);
    }

    public String createSpeakerModel(String speakerName, byte[] audio, RequestOptions options) {
        Arguments.requireNonBlank(speakerName, "speakerName");
        if (audio == null || audio.length == 0) {
            throw new IllegalArgumentException("audio must not be empty");
        }
        ApiOperation<String> operation = ApiOperation
                .builder(HttpMethod.POST, SPEAKERS_PATH, ResponseDecoder.jsonField("speaker_id", SPEAKER_ID))
                .name("createSpeakerModel")
                .queryParam("speaker_name", speakerName)
                .payload(RequestPayload.binary(audio, RequestPayload.WAV))
                .successStatus(201)
                .resourceId(speakerName)
                .errors(BAD_REQUEST, UNAUTHORIZED, UNSUPPORTED_MEDIA_TYPE, INTERNAL_SERVER_ERROR,
                        SERVICE_UNAVAILABLE)
                .build();
        String speakerId = executor.execute(operation, options);
        log.info("[TTS] Speaker model created: name={}, id={}", speakerName, speakerId);
        return speakerId;
    }

    /**
     * Lists the custom models that hold prompts recorded by the speaker.
     */
    public List<SpeakerCustomModel> getSpeakerModel(String speakerId) {
        return getSpeakerModel(speakerId, RequestOptions.defaults());
    }

    public List<SpeakerCustomModel> getSpeakerModel(String speakerId, RequestOptions options) {
        Arguments.requireNonBlank(speakerId, "speakerId");
        ApiOperation<List<SpeakerCustomModel>> operation = ApiOperation
                .builder(HttpMethod.GET, SPEAKER_PATH,
                        ResponseDecoder.jsonField("customizations", SPEAKER_MODEL_LIST))
                .name("getSpeakerModel")
                .pathParam("speaker_id", speakerId)
                .resourceId(speakerId)
                .errors(NOT_MODIFIED, BAD_REQUEST, UNAUTHORIZED, INTERNAL_SERVER_ERROR, SERVICE_UNAVAILABLE)
                .build();
        return executor.execute(operation, options);
    }

    public void deleteSpeakerModel(String speakerId) {
        deleteSpeakerModel(speakerId, RequestOptions.defaults());
    }

    public void deleteSpeakerModel(String speakerId, RequestOptions options) {
        Arguments.requireNonBlank(speakerId, "speakerId");
        ApiOperation<Void> operation = ApiOperation
                .builder(HttpMethod.DELETE, SPEAKER_PATH, ResponseDecoder.discarding())
                .name("deleteSpeakerModel")
                .pathParam("speaker_id", speakerId)
                .successStatus(204)
                .resourceId(speakerId)
                .errors(BAD_REQUEST, UNAUTHORIZED, INTERNAL_SERVER_ERROR, SERVICE_UNAVAILABLE)
                .build();
        executor.execute(operation, options);
        log.info("[TTS] Speaker model deleted: id={}", speakerId);
    }
}
