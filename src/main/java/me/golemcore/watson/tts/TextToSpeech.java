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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.watson.auth.BearerTokenSource;
import me.golemcore.watson.http.ServiceEndpoint;
import me.golemcore.watson.http.WatsonHttpExecutor;
import me.golemcore.watson.tts.model.AudioFormat;
import me.golemcore.watson.tts.model.Voice;
import me.golemcore.watson.tts.model.WatsonVoice;
import okhttp3.OkHttpClient;

import java.util.List;

/**
 * Entry point to one Text to Speech service instance.
 *
 * <p>
 * Resource groups are exposed through dedicated clients sharing one executor.
 * The only mutable state is the default voice, used by synthesis and
 * pronunciation calls that do not name a voice. Changing it while such calls
 * are in flight is allowed; a racing call sees either value.
 */
@Slf4j
public class TextToSpeech {

    private final WatsonHttpExecutor executor;
    private final VoicesClient voices;
    private final CustomModelsClient customModels;
    private final CustomWordsClient words;
    private final CustomPromptsClient prompts;
    private final SpeakerModelsClient speakers;
    private final PronunciationClient pronunciation;
    private final SynthesisClient synthesis;
    private final UserDataClient userData;

    private volatile WatsonVoice defaultVoice;

    public TextToSpeech(OkHttpClient okHttpClient, ObjectMapper objectMapper, ServiceEndpoint endpoint,
            BearerTokenSource tokenSource) {
        this(new WatsonHttpExecutor(okHttpClient, objectMapper, endpoint, tokenSource), WatsonVoice.DEFAULT);
    }

    public TextToSpeech(WatsonHttpExecutor executor, WatsonVoice defaultVoice) {
        this.executor = executor;
        this.defaultVoice = defaultVoice != null ? defaultVoice : WatsonVoice.DEFAULT;
        this.voices = new VoicesClient(executor);
        this.customModels = new CustomModelsClient(executor);
        this.words = new CustomWordsClient(executor);
        this.prompts = new CustomPromptsClient(executor);
        this.speakers = new SpeakerModelsClient(executor);
        this.pronunciation = new PronunciationClient(executor, this::getDefaultVoice);
        this.synthesis = new SynthesisClient(executor, this::getDefaultVoice);
        this.userData = new UserDataClient(executor);
        log.debug("[TTS] Client created for {} with default voice {}", executor.getEndpoint(),
                this.defaultVoice.getId());
    }

    public WatsonVoice getDefaultVoice() {
        return defaultVoice;
    }

    public void setDefaultVoice(WatsonVoice voice) {
        if (voice == null) {
            throw new IllegalArgumentException("voice is required");
        }
        this.defaultVoice = voice;
    }

    public ServiceEndpoint getEndpoint() {
        return executor.getEndpoint();
    }

    public List<Voice> listVoices() {
        return voices.listVoices();
    }

    /**
     * Synthesizes with the current default voice.
     */
    public byte[] synthesize(String text, AudioFormat format, String customizationId) {
        return synthesis.synthesize(text, format, customizationId);
    }

    public byte[] synthesize(String text) {
        return synthesis.synthesize(text, null, null);
    }

    public VoicesClient voices() {
        return voices;
    }

    public CustomModelsClient customModels() {
        return customModels;
    }

    public CustomWordsClient words() {
        return words;
    }

    public CustomPromptsClient prompts() {
        return prompts;
    }

    public SpeakerModelsClient speakers() {
        return speakers;
    }

    public PronunciationClient pronunciation() {
        return pronunciation;
    }

    public SynthesisClient synthesis() {
        return synthesis;
    }

    public UserDataClient userData() {
        return userData;
    }
}
