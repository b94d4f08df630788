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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.watson.http.ApiOperation;
import me.golemcore.watson.http.HttpMethod;
import me.golemcore.watson.http.RequestOptions;
import me.golemcore.watson.http.ResponseDecoder;
import me.golemcore.watson.http.WatsonHttpExecutor;
import me.golemcore.watson.tts.model.AudioFormat;
import me.golemcore.watson.tts.model.WatsonVoice;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import static me.golemcore.watson.error.WatsonErrorKind.BAD_REQUEST;
import static me.golemcore.watson.error.WatsonErrorKind.INTERNAL_SERVER_ERROR;
import static me.golemcore.watson.error.WatsonErrorKind.NOT_ACCEPTABLE;
import static me.golemcore.watson.error.WatsonErrorKind.NOT_FOUND;
import static me.golemcore.watson.error.WatsonErrorKind.SERVICE_UNAVAILABLE;
import static me.golemcore.watson.error.WatsonErrorKind.UNSUPPORTED_MEDIA_TYPE;

/**
 * Text to audio synthesis.
 *
 * <p>
 * The output format travels in the {@code accept} query parameter. When no
 * format is given the parameter is omitted and the service returns its
 * default, Ogg/Opus.
 */
@Slf4j
@RequiredArgsConstructor
public class SynthesisClient {

    private final WatsonHttpExecutor executor;
    private final Supplier<WatsonVoice> defaultVoice;

    public byte[] synthesize(String text, AudioFormat format, String customizationId) {
        return synthesize(text, format, customizationId, null, RequestOptions.defaults());
    }

    /**
     * Synthesizes text to audio bytes.
     *
     * @param text
     *            plain text or SSML
     * @param format
     *            output format; {@code null} for the service default
     * @param customizationId
     *            optional custom model to apply
     * @param voice
     *            voice to speak with; {@code null} for the current default
     *            voice
     */
    public byte[] synthesize(String text, AudioFormat format, String customizationId, WatsonVoice voice,
            RequestOptions options) {
        ApiOperation<byte[]> operation = synthesisOperation(text, format, customizationId, voice);
        byte[] audio = executor.execute(operation, options);
        log.debug("[TTS] Synthesized {} chars -> {} bytes", text.length(), audio.length);
        return audio;
    }

    /**
     * Asynchronous variant of
     * {@link #synthesize(String, AudioFormat, String, WatsonVoice, RequestOptions)}.
     * Cancelling the future cancels the request.
     */
    public CompletableFuture<byte[]> synthesizeAsync(String text, AudioFormat format, String customizationId,
            WatsonVoice voice, RequestOptions options) {
        return executor.executeAsync(synthesisOperation(text, format, customizationId, voice), options);
    }

    private ApiOperation<byte[]> synthesisOperation(String text, AudioFormat format, String customizationId,
            WatsonVoice voice) {
        Arguments.requireNonBlank(text, "text");
        WatsonVoice effectiveVoice = voice != null ? voice : defaultVoice.get();
        return ApiOperation
                .builder(HttpMethod.GET, "v1/synthesize", ResponseDecoder.bytes())
                .name("synthesize")
                .queryParam("text", text)
                .queryParam("voice", effectiveVoice.getId())
                .queryParam("accept", format != null ? format.getMimeType() : null)
                .queryParam("customization_id", customizationId)
                .accept(null)
                .resourceId(customizationId)
                .errors(BAD_REQUEST, NOT_FOUND, NOT_ACCEPTABLE, UNSUPPORTED_MEDIA_TYPE, INTERNAL_SERVER_ERROR,
                        SERVICE_UNAVAILABLE)
                .build();
    }
}
