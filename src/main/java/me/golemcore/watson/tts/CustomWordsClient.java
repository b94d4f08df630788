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
import me.golemcore.watson.error.WatsonErrorKind;
import me.golemcore.watson.http.ApiOperation;
import me.golemcore.watson.http.HttpMethod;
import me.golemcore.watson.http.RequestOptions;
import me.golemcore.watson.http.RequestPayload;
import me.golemcore.watson.http.ResponseDecoder;
import me.golemcore.watson.http.WatsonHttpExecutor;
import me.golemcore.watson.tts.model.Word;
import me.golemcore.watson.tts.model.WordTranslation;

import java.util.List;
import java.util.Map;

import static me.golemcore.watson.error.WatsonErrorKind.BAD_REQUEST;
import static me.golemcore.watson.error.WatsonErrorKind.INTERNAL_SERVER_ERROR;
import static me.golemcore.watson.error.WatsonErrorKind.SERVICE_UNAVAILABLE;
import static me.golemcore.watson.error.WatsonErrorKind.UNAUTHORIZED;

/**
 * Word translations of a custom model.
 */
@RequiredArgsConstructor
public class CustomWordsClient {

    private static final String WORDS_PATH = "v1/customizations/{customization_id}/words";
    private static final String WORD_PATH = "v1/customizations/{customization_id}/words/{word}";
    private static final TypeReference<List<Word>> WORD_LIST = new TypeReference<>() {
    };
    private static final WatsonErrorKind[] WORD_ERRORS = {
            BAD_REQUEST, UNAUTHORIZED, INTERNAL_SERVER_ERROR, SERVICE_UNAVAILABLE };

    private final WatsonHttpExecutor executor;

    /**
     * Adds or replaces several words at once.
     */
    public void addCustomWords(String customizationId, List<Word> words) {
        addCustomWords(customizationId, words, RequestOptions.defaults());
    }

    public void addCustomWords(String customizationId, List<Word> words, RequestOptions options) {
        Arguments.requireNonBlank(customizationId, "customizationId");
        if (words == null || words.isEmpty()) {
            throw new IllegalArgumentException("words must not be empty");
        }
        ApiOperation<Void> operation = ApiOperation
                .builder(HttpMethod.POST, WORDS_PATH, ResponseDecoder.discarding())
                .name("addCustomWords")
                .pathParam("customization_id", customizationId)
                .payload(RequestPayload.json(Map.of("words", words)))
                .resourceId(customizationId)
                .errors(WORD_ERRORS)
                .build();
        executor.execute(operation, options);
    }

    public List<Word> listCustomWords(String customizationId) {
        return listCustomWords(customizationId, RequestOptions.defaults());
    }

    public List<Word> listCustomWords(String customizationId, RequestOptions options) {
        Arguments.requireNonBlank(customizationId, "customizationId");
        ApiOperation<List<Word>> operation = ApiOperation
                .builder(HttpMethod.GET, WORDS_PATH, ResponseDecoder.jsonField("words", WORD_LIST))
                .name("listCustomWords")
                .pathParam("customization_id", customizationId)
                .resourceId(customizationId)
                .errors(WORD_ERRORS)
                .build();
        return executor.execute(operation, options);
    }

    /**
     * Adds or replaces a single word.
     */
    public void addCustomWord(String customizationId, String word, WordTranslation translation) {
        addCustomWord(customizationId, word, translation, RequestOptions.defaults());
    }

    public void addCustomWord(String customizationId, String word, WordTranslation translation,
            RequestOptions options) {
        Arguments.requireNonBlank(customizationId, "customizationId");
        Arguments.requireNonBlank(word, "word");
        if (translation == null) {
            throw new IllegalArgumentException("translation is required");
        }
        ApiOperation<Void> operation = ApiOperation
                .builder(HttpMethod.PUT, WORD_PATH, ResponseDecoder.discarding())
                .name("addCustomWord")
                .pathParam("customization_id", customizationId)
                .pathParam("word", word)
                .payload(RequestPayload.json(translation))
                .resourceId(customizationId)
                .errors(WORD_ERRORS)
                .build();
        executor.execute(operation, options);
    }

    public WordTranslation getCustomWord(String customizationId, String word) {
        return getCustomWord(customizationId, word, RequestOptions.defaults());
    }

    public WordTranslation getCustomWord(String customizationId, String word, RequestOptions options) {
        Arguments.requireNonBlank(customizationId, "customizationId");
        Arguments.requireNonBlank(word, "word");
        ApiOperation<WordTranslation> operation = ApiOperation
                .builder(HttpMethod.GET, WORD_PATH, ResponseDecoder.json(WordTranslation.class))
                .name("getCustomWord")
                .pathParam("customization_id", customizationId)
                .pathParam("word", word)
                .resourceId(customizationId)
                .errors(WORD_ERRORS)
                .build();
        return executor.execute(operation, options);
    }

    public void deleteCustomWord(String customizationId, String word) {
        deleteCustomWord(customizationId, word, RequestOptions.defaults());
    }

    public void deleteCustomWord(String customizationId, String word, RequestOptions options) {
        Arguments.requireNonBlank(customizationId, "customizationId");
        Arguments.requireNonBlank(word, "word");
        ApiOperation<Void> operation = ApiOperation
                .builder(HttpMethod.DELETE, WORD_PATH, ResponseDecoder.discarding())
                .name("deleteCustomWord")
                .pathParam("customization_id", customizationId)
                .pathParam("word", word)
                .successStatus(204)
                .resourceId(customizationId)
                .errors(WORD_ERRORS)
                .build();
        executor.execute(operation, options);
    }
}
