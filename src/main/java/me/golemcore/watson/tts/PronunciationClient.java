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
import me.golemcore.watson.http.ApiOperation;
import me.golemcore.watson.http.HttpMethod;
import me.golemcore.watson.http.RequestOptions;
import me.golemcore.watson.http.ResponseDecoder;
import me.golemcore.watson.http.WatsonHttpExecutor;
import me.golemcore.watson.tts.model.PhonemeFormat;
import me.golemcore.watson.tts.model.Pronunciation;
import me.golemcore.watson.tts.model.WatsonVoice;

import java.util.function.Supplier;

import static me.golemcore.watson.error.WatsonErrorKind.BAD_REQUEST;
import static me.golemcore.watson.error.WatsonErrorKind.INTERNAL_SERVER_ERROR;
import static me.golemcore.watson.error.WatsonErrorKind.NOT_ACCEPTABLE;
import static me.golemcore.watson.error.WatsonErrorKind.NOT_FOUND;
import static me.golemcore.watson.error.WatsonErrorKind.SERVICE_UNAVAILABLE;
import static me.golemcore.watson.error.WatsonErrorKind.UNAUTHORIZED;

@RequiredArgsConstructor
public class PronunciationClient {

    private final WatsonHttpExecutor executor;
    private final Supplier<WatsonVoice> defaultVoice;

    /**
     * Gets the phonetic pronunciation of a word.
     *
     * @param text
     *            the word
     * @param voice
     *            voice whose language is used; {@code null} for the current
     *            default voice
     * @param format
     *            phoneme notation; {@code null} lets the service choose
     * @param customizationId
     *            optional custom model whose translation is returned
     */
    public Pronunciation getPronunciation(String text, WatsonVoice voice, PhonemeFormat format,
            String customizationId) {
        return getPronunciation(text, voice, format, customizationId, RequestOptions.defaults());
    }

    public Pronunciation getPronunciation(String text, WatsonVoice voice, PhonemeFormat format,
            String customizationId, RequestOptions options) {
        Arguments.requireNonBlank(text, "text");
        WatsonVoice effectiveVoice = voice != null ? voice : defaultVoice.get();
        ApiOperation<Pronunciation> operation = ApiOperation
                .builder(HttpMethod.GET, "v1/pronunciation", ResponseDecoder.json(Pronunciation.class))
                .name("getPronunciation")
                .queryParam("text", text)
                .queryParam("voice", effectiveVoice.getId())
                .queryParam("format", format != null ? format.getId() : null)
                .queryParam("customization_id", customizationId)
                .resourceId(customizationId)
                .errors(BAD_REQUEST, UNAUTHORIZED, NOT_FOUND, NOT_ACCEPTABLE, INTERNAL_SERVER_ERROR,
                        SERVICE_UNAVAILABLE)
                .build();
        return executor.execute(operation, options);
    }
}
